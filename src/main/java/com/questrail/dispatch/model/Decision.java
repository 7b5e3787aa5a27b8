package com.questrail.dispatch.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Decision
 * -----------------------------------------------------------------------------
 * A recommendation for a single train.
 *
 * <h2>Ownership</h2>
 * The precedence engine creates decisions with {@code applied == false} and
 * never changes that flag. Whether a decision was acted upon is recorded by
 * the collaborator that applies it, via {@link #markApplied()}.
 *
 * @param id             identity
 * @param train          the train the decision is for
 * @param action         proceed / wait (reroute / cross reserved)
 * @param targetSection  section the train is cleared onto, if any
 * @param targetStation  station the train is routed to, if any
 * @param estimatedTime  clock time at which the action is expected to take effect
 * @param reason         human-readable justification
 * @param confidence     confidence in [0.0, 1.0]
 * @param applied        whether a collaborator has applied this decision
 * @param createdAt      creation time
 */
public record Decision(
        UUID id,
        Train train,
        DecisionAction action,
        Optional<Section> targetSection,
        Optional<Station> targetStation,
        Optional<Instant> estimatedTime,
        String reason,
        double confidence,
        boolean applied,
        Instant createdAt
) {
    public Decision {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(train, "train");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(targetSection, "targetSection");
        Objects.requireNonNull(targetStation, "targetStation");
        Objects.requireNonNull(estimatedTime, "estimatedTime");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(createdAt, "createdAt");

        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0]: " + confidence);
        }
    }

    /**
     * Clears the train onto {@code section}.
     */
    public static Decision proceed(Train train, Optional<Section> section, String reason,
                                   double confidence, Instant createdAt) {
        return new Decision(UUID.randomUUID(), train, DecisionAction.PROCEED, section,
                Optional.empty(), Optional.empty(), reason, confidence, false, createdAt);
    }

    /**
     * Holds the train until {@code estimatedTime}.
     */
    public static Decision hold(Train train, Optional<Instant> estimatedTime, String reason,
                                double confidence, Instant createdAt) {
        return new Decision(UUID.randomUUID(), train, DecisionAction.WAIT, Optional.empty(),
                Optional.empty(), estimatedTime, reason, confidence, false, createdAt);
    }

    public boolean isProceed() {
        return action == DecisionAction.PROCEED;
    }

    public boolean isWait() {
        return action == DecisionAction.WAIT;
    }

    /**
     * Returns a copy flagged as applied.
     */
    public Decision markApplied() {
        return new Decision(id, train, action, targetSection, targetStation, estimatedTime,
                reason, confidence, true, createdAt);
    }
}
