package com.questrail.dispatch.metrics;

/**
 * Scores computed for one decision set.
 *
 * @param delayReductionMinutes estimated minutes recovered
 * @param throughputImprovement estimated throughput gain, percent
 * @param confidence            aggregate confidence, 0.0-1.0
 */
public record OptimizationMetrics(
        int delayReductionMinutes,
        double throughputImprovement,
        double confidence
) {
}
