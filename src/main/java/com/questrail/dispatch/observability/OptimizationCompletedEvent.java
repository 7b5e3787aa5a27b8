package com.questrail.dispatch.observability;

import com.questrail.dispatch.api.OptimizationOutcome;

import java.time.Instant;

/**
 * Record summarizing a finished optimization pass.
 */
public record OptimizationCompletedEvent(
    Instant timestamp,
    OptimizationOutcome outcome,
    int decisionCount,
    int delayReductionMinutes,
    double confidence,
    double computationTimeSeconds
) {
}
