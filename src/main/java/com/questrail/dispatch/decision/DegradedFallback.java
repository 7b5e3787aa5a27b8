package com.questrail.dispatch.decision;

import com.questrail.dispatch.api.OptimizationOutcome;
import com.questrail.dispatch.config.PrecedencePolicy;
import com.questrail.dispatch.model.Decision;
import com.questrail.dispatch.model.OptimizationResult;
import com.questrail.dispatch.model.SystemState;
import com.questrail.dispatch.model.Train;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DegradedFallback
 * -----------------------------------------------------------------------------
 * Safety output used when the optimization pipeline fails unexpectedly.
 *
 * <p>Every running or delayed train, with or without a section, is told to
 * proceed with caution at the degraded confidence. Metrics are zero and the
 * computation time is reported as 0.0.</p>
 *
 * <p>This path reads only train status and section from the snapshot, so it
 * stays available whatever broke upstream.</p>
 */
public final class DegradedFallback
{
    public static final String REASON = "Fallback: proceed with caution";

    private final PrecedencePolicy policy;

    public DegradedFallback(PrecedencePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public OptimizationResult resultFor(SystemState state, Instant createdAt) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");

        List<Decision> decisions = new ArrayList<>();
        for (Train train : state.trains()) {
            if (train.status().isActive()) {
                decisions.add(Decision.proceed(
                        train,
                        train.currentSection(),
                        REASON,
                        policy.degradedConfidence(),
                        createdAt));
            }
        }

        return new OptimizationResult(
                decisions,
                0,
                0.0,
                policy.degradedConfidence(),
                0.0,
                OptimizationOutcome.DEGRADED,
                createdAt);
    }
}
