package com.questrail.dispatch.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decorator that keeps a failing sink from breaking an optimization pass.
 * <p>
 * A {@link RuntimeException} thrown by the delegate is logged at WARN and the
 * pass continues.
 */
public final class GuardedObservabilitySink implements OptimizerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(GuardedObservabilitySink.class);

    private final OptimizerObservabilitySink delegate;

    public GuardedObservabilitySink(OptimizerObservabilitySink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void onStageTransition(StageTransitionEvent event) {
        try {
            delegate.onStageTransition(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on stage transition {} -> {}", event.from(), event.to(), e);
        }
    }

    @Override
    public void onSolveOutcome(SolveOutcomeEvent event) {
        try {
            delegate.onSolveOutcome(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on solve outcome {}", event.solverStatus(), e);
        }
    }

    @Override
    public void onCompleted(OptimizationCompletedEvent event) {
        try {
            delegate.onCompleted(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on completion {}", event.outcome(), e);
        }
    }

    @Override
    public void onError(OptimizationErrorEvent event) {
        try {
            delegate.onError(event);
        } catch (RuntimeException e) {
            log.warn("Observability sink failed on error in {}: {}", event.stage(), event.message(), e);
        }
    }
}
