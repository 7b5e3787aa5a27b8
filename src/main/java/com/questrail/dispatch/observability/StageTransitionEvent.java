package com.questrail.dispatch.observability;

import com.questrail.dispatch.core.OptimizerStage;

import java.time.Instant;

/**
 * Record representing a stage change within one optimization pass.
 */
public record StageTransitionEvent(
    Instant timestamp,
    OptimizerStage from,
    OptimizerStage to
) {
    public boolean isTerminal() {
        return to.isTerminal();
    }
}
