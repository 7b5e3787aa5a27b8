package com.questrail.dispatch.observability;

import com.questrail.dispatch.core.OptimizerStage;

import java.time.Instant;

/**
 * Record representing an unexpected failure inside an optimization pass.
 */
public record OptimizationErrorEvent(
    Instant timestamp,
    OptimizerStage stage,
    String message,
    Throwable cause
) {
}
