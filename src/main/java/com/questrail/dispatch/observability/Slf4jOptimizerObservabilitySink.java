package com.questrail.dispatch.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of OptimizerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jOptimizerObservabilitySink implements OptimizerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOptimizerObservabilitySink.class);

    @Override
    public void onStageTransition(StageTransitionEvent event) {
        log.debug("Optimizer stage: {} -> {}", event.from(), event.to());
    }

    @Override
    public void onSolveOutcome(SolveOutcomeEvent event) {
        if (event.isHeuristicFallback()) {
            log.warn("Precedence solver returned {} for {} trains after {}s, using heuristic order",
                event.solverStatus(),
                event.trainCount(),
                event.solveSeconds());
            return;
        }

        log.info("Precedence solver {}: {} trains, {} conflicts, {} forced, {}s",
            event.solverStatus(),
            event.trainCount(),
            event.exclusivePairs(),
            event.forcedPairs(),
            event.solveSeconds());

        if (event.overCapacity() > 0) {
            log.debug("{} section(s) hold more trains than tracks", event.overCapacity());
        }
    }

    @Override
    public void onCompleted(OptimizationCompletedEvent event) {
        log.info("Optimization {}: {} decisions, {} min delay reduction, confidence {}, {}s",
            event.outcome(),
            event.decisionCount(),
            event.delayReductionMinutes(),
            event.confidence(),
            event.computationTimeSeconds());
    }

    @Override
    public void onError(OptimizationErrorEvent event) {
        log.error("Optimization failed in {}: {}", event.stage(), event.message(), event.cause());
    }
}
