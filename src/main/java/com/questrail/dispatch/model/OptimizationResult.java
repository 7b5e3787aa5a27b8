package com.questrail.dispatch.model;

import com.questrail.dispatch.api.OptimizationOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Output of one optimization pass.
 *
 * @param decisions                one decision per train the pass covered
 * @param totalDelayReductionMinutes estimated minutes of delay recovered, never negative
 * @param throughputImprovement    estimated throughput gain in percent, 0-100
 * @param confidenceScore          aggregate confidence, 0.0-1.0
 * @param computationTimeSeconds   wall-clock seconds spent, never negative
 * @param outcome                  which path produced this result
 * @param createdAt                creation time
 */
public record OptimizationResult(
        List<Decision> decisions,
        int totalDelayReductionMinutes,
        double throughputImprovement,
        double confidenceScore,
        double computationTimeSeconds,
        OptimizationOutcome outcome,
        Instant createdAt
) {
    public OptimizationResult {
        decisions = List.copyOf(Objects.requireNonNull(decisions, "decisions"));
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(createdAt, "createdAt");

        if (totalDelayReductionMinutes < 0) {
            throw new IllegalArgumentException("totalDelayReductionMinutes must be non-negative");
        }
        if (Double.isNaN(throughputImprovement) || throughputImprovement < 0.0 || throughputImprovement > 100.0) {
            throw new IllegalArgumentException("throughputImprovement must be in [0, 100]: " + throughputImprovement);
        }
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be in [0.0, 1.0]: " + confidenceScore);
        }
        if (Double.isNaN(computationTimeSeconds) || computationTimeSeconds < 0.0) {
            throw new IllegalArgumentException("computationTimeSeconds must be non-negative");
        }
    }

    /**
     * Result for a snapshot in which no train needed a decision.
     */
    public static OptimizationResult empty(Instant createdAt) {
        return new OptimizationResult(List.of(), 0, 0.0, 1.0, 0.0, OptimizationOutcome.TRIVIAL, createdAt);
    }
}
