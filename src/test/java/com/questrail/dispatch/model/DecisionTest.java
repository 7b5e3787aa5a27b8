package com.questrail.dispatch.model;

import com.questrail.dispatch.NetworkFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    private final Section section = NetworkFixtures.singleTrack();
    private final Train train = NetworkFixtures.running("12345", TrainType.EXPRESS, section, 5);
    private final Instant now = NetworkFixtures.SNAPSHOT_TIME;

    @Test
    void proceedCarriesTargetSection() {
        Decision decision = Decision.proceed(train, Optional.of(section), "go", 0.9, now);

        assertEquals(DecisionAction.PROCEED, decision.action());
        assertEquals("proceed", decision.action().code());
        assertEquals(Optional.of(section), decision.targetSection());
        assertFalse(decision.applied());
    }

    @Test
    void holdHasNoTargetSection() {
        Decision decision = Decision.hold(train, Optional.of(now.plusSeconds(300)), "wait", 0.8, now);

        assertTrue(decision.isWait());
        assertEquals(Optional.empty(), decision.targetSection());
        assertEquals(Optional.of(now.plusSeconds(300)), decision.estimatedTime());
    }

    @Test
    void confidenceMustBeWithinUnitInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> Decision.proceed(train, Optional.empty(), "x", 1.01, now));
        assertThrows(IllegalArgumentException.class,
                () -> Decision.proceed(train, Optional.empty(), "x", -0.1, now));
        assertThrows(IllegalArgumentException.class,
                () -> Decision.proceed(train, Optional.empty(), "x", Double.NaN, now));
    }

    @Test
    void markAppliedKeepsIdentity() {
        Decision decision = Decision.proceed(train, Optional.of(section), "go", 0.9, now);
        Decision applied = decision.markApplied();

        assertTrue(applied.applied());
        assertEquals(decision.id(), applied.id());
        assertFalse(decision.applied());
    }
}
