package com.questrail.dispatch.observability;

/**
 * No-op implementation of OptimizerObservabilitySink.
 */
public final class NullObservabilitySink implements OptimizerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStageTransition(StageTransitionEvent event) {}

    @Override
    public void onSolveOutcome(SolveOutcomeEvent event) {}

    @Override
    public void onCompleted(OptimizationCompletedEvent event) {}

    @Override
    public void onError(OptimizationErrorEvent event) {}
}
