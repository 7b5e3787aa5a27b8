package com.questrail.dispatch.observability;

/**
 * Main interface for receiving optimizer observability events.
 * Implementations can provide logging, metrics, or tracing.
 * <p>
 * Sinks are called synchronously on the optimizing thread. They should not
 * throw; the optimizer wraps every sink in a {@link GuardedObservabilitySink}.
 */
public interface OptimizerObservabilitySink {
    /**
     * Called whenever a pass moves to another stage.
     * @param event the transition details
     */
    void onStageTransition(StageTransitionEvent event);

    /**
     * Called once per pass that reaches the solver.
     * @param event solver status and chosen path
     */
    void onSolveOutcome(SolveOutcomeEvent event);

    /**
     * Called when a pass reaches a terminal stage.
     * @param event result summary
     */
    void onCompleted(OptimizationCompletedEvent event);

    /**
     * Called when a stage fails and the degraded fallback is used.
     * @param event the error event
     */
    void onError(OptimizationErrorEvent event);
}
