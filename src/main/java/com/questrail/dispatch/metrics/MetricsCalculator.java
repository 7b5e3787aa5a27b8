package com.questrail.dispatch.metrics;

import com.questrail.dispatch.config.PrecedencePolicy;
import com.questrail.dispatch.model.Decision;

import java.util.List;
import java.util.Objects;

/**
 * MetricsCalculator
 * -----------------------------------------------------------------------------
 * Estimates the benefit of a decision set and how far to trust it.
 *
 * <h2>Delay reduction</h2>
 * Each proceeding train that is currently delayed is credited with its delay,
 * capped at the policy maximum (10 min by default).
 *
 * <h2>Throughput improvement</h2>
 * {@code proceeding / total * scale} percent, 0 for an empty set. With the
 * default 20 % scale the value stays within [0, 20].
 *
 * <h2>Confidence</h2>
 * Mean decision confidence, discounted by {@code min(1, trainCount / N)} where
 * N is the saturation size (20 by default). Small snapshots are treated as less
 * reliable. An empty decision set is fully confident.
 */
public final class MetricsCalculator
{
    private final PrecedencePolicy policy;

    public MetricsCalculator(PrecedencePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param decisions  decisions of one pass
     * @param trainCount number of trains in the snapshot
     */
    public OptimizationMetrics score(List<Decision> decisions, int trainCount) {
        return new OptimizationMetrics(
                delayReduction(decisions),
                throughputImprovement(decisions),
                confidence(decisions, trainCount));
    }

    public int delayReduction(List<Decision> decisions) {
        Objects.requireNonNull(decisions, "decisions");
        int total = 0;
        for (Decision decision : decisions) {
            if (decision.isProceed() && decision.train().isDelayed()) {
                total += Math.min(decision.train().delayMinutes(), policy.maxCreditedDelayMinutes());
            }
        }
        return total;
    }

    public double throughputImprovement(List<Decision> decisions) {
        Objects.requireNonNull(decisions, "decisions");
        if (decisions.isEmpty()) {
            return 0.0;
        }
        long proceeding = decisions.stream().filter(Decision::isProceed).count();
        return ((double) proceeding / decisions.size()) * policy.throughputScalePercent();
    }

    public double confidence(List<Decision> decisions, int trainCount) {
        Objects.requireNonNull(decisions, "decisions");
        if (trainCount < 0) {
            throw new IllegalArgumentException("trainCount must be non-negative");
        }
        if (decisions.isEmpty()) {
            return 1.0;
        }

        double mean = decisions.stream()
                .mapToDouble(Decision::confidence)
                .average()
                .orElse(1.0);
        double sizeFactor = Math.min(1.0, trainCount / (double) policy.confidenceSaturationTrains());

        // Rounding can push the product a hair past 1.0.
        return Math.max(0.0, Math.min(1.0, mean * sizeFactor));
    }
}
