package com.questrail.dispatch.config;

import java.time.Duration;
import java.util.Objects;

/**
 * PrecedencePolicy
 * -----------------------------------------------------------------------------
 * The fixed numbers behind precedence decisions and their scoring.
 *
 * <p>{@link #defaults()} is the production policy. The record exists so that
 * every constant has one name and one place; tests and experiments may build
 * other policies, but the engine's documented behaviour is the default.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>priorityOverrideDelayMinutes</b>: a lower-priority train may be
 *       ordered ahead of a higher-priority one only if it is at least this many
 *       minutes more delayed. Below the threshold the higher priority wins.</li>
 *   <li><b>objectivePriorityWeight</b>: multiplier applied to priority when
 *       weighting each train's delay in the solver objective.</li>
 *   <li><b>waitPerRank</b>: estimated hold time per train ordered ahead.</li>
 *   <li><b>maxCreditedDelayMinutes</b>: most delay reduction credited to a
 *       single proceeding train.</li>
 *   <li><b>throughputScalePercent</b>: throughput gain reported when every
 *       decision is "proceed".</li>
 *   <li><b>confidenceSaturationTrains</b>: snapshot size at which the
 *       small-sample confidence discount stops applying.</li>
 *   <li><b>solved/heuristic/degraded confidences</b>: per-decision confidence
 *       for each path.</li>
 * </ul>
 */
public record PrecedencePolicy(
        int priorityOverrideDelayMinutes,
        int objectivePriorityWeight,
        Duration waitPerRank,
        int maxCreditedDelayMinutes,
        double throughputScalePercent,
        int confidenceSaturationTrains,
        double solvedProceedConfidence,
        double solvedWaitConfidence,
        double heuristicProceedConfidence,
        double heuristicWaitConfidence,
        double degradedConfidence
) {
    public PrecedencePolicy {
        Objects.requireNonNull(waitPerRank, "waitPerRank");

        if (priorityOverrideDelayMinutes < 0) {
            throw new IllegalArgumentException("priorityOverrideDelayMinutes must be non-negative");
        }
        if (objectivePriorityWeight < 0) {
            throw new IllegalArgumentException("objectivePriorityWeight must be non-negative");
        }
        if (waitPerRank.isNegative()) {
            throw new IllegalArgumentException("waitPerRank must be non-negative");
        }
        if (maxCreditedDelayMinutes < 0) {
            throw new IllegalArgumentException("maxCreditedDelayMinutes must be non-negative");
        }
        if (throughputScalePercent < 0.0 || throughputScalePercent > 100.0) {
            throw new IllegalArgumentException("throughputScalePercent must be in [0, 100]");
        }
        if (confidenceSaturationTrains < 1) {
            throw new IllegalArgumentException("confidenceSaturationTrains must be >= 1");
        }
        requireUnit(solvedProceedConfidence, "solvedProceedConfidence");
        requireUnit(solvedWaitConfidence, "solvedWaitConfidence");
        requireUnit(heuristicProceedConfidence, "heuristicProceedConfidence");
        requireUnit(heuristicWaitConfidence, "heuristicWaitConfidence");
        requireUnit(degradedConfidence, "degradedConfidence");
    }

    private static void requireUnit(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0.0, 1.0]");
        }
    }

    /**
     * Production policy.
     *
     * <ul>
     *   <li>priority override: 30 min</li>
     *   <li>objective weight: 10 x priority</li>
     *   <li>wait per rank: 5 min</li>
     *   <li>delay credit cap: 10 min per train</li>
     *   <li>throughput scale: 20 %</li>
     *   <li>confidence saturation: 20 trains</li>
     *   <li>confidences: solved 0.9 / 0.8, heuristic 0.6 / 0.5, degraded 0.3</li>
     * </ul>
     */
    public static PrecedencePolicy defaults() {
        return new PrecedencePolicy(
                30,
                10,
                Duration.ofMinutes(5),
                10,
                20.0,
                20,
                0.9,
                0.8,
                0.6,
                0.5,
                0.3
        );
    }
}
