package com.questrail.dispatch.observability;

import com.questrail.dispatch.core.OptimizerStage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GuardedObservabilitySinkTest {

    private final Instant now = Instant.parse("2024-03-01T08:00:00Z");

    @Test
    void forwardsEventsToDelegate() {
        RecordingObservabilitySink recording = new RecordingObservabilitySink();
        OptimizerObservabilitySink guarded = new GuardedObservabilitySink(recording);

        guarded.onStageTransition(new StageTransitionEvent(now, OptimizerStage.IDLE, OptimizerStage.FILTERING));
        guarded.onError(new OptimizationErrorEvent(now, OptimizerStage.SOLVING, "boom", new IllegalStateException()));

        assertEquals(List.of(OptimizerStage.FILTERING), recording.getStagePath());
        assertTrue(recording.hasEventOfType(OptimizationErrorEvent.class));
    }

    @Test
    void delegateFailureDoesNotPropagate() {
        OptimizerObservabilitySink failing = new OptimizerObservabilitySink() {
            @Override
            public void onStageTransition(StageTransitionEvent event) {
                throw new IllegalStateException("down");
            }

            @Override
            public void onSolveOutcome(SolveOutcomeEvent event) {
                throw new IllegalStateException("down");
            }

            @Override
            public void onCompleted(OptimizationCompletedEvent event) {
                throw new IllegalStateException("down");
            }

            @Override
            public void onError(OptimizationErrorEvent event) {
                throw new IllegalStateException("down");
            }
        };
        OptimizerObservabilitySink guarded = new GuardedObservabilitySink(failing);

        assertDoesNotThrow(() ->
                guarded.onStageTransition(new StageTransitionEvent(now, OptimizerStage.IDLE, OptimizerStage.FILTERING)));
        assertDoesNotThrow(() ->
                guarded.onError(new OptimizationErrorEvent(now, OptimizerStage.SOLVING, "boom", new IllegalStateException())));
    }
}
