package com.questrail.dispatch.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrecedencePolicyTest {

    @Test
    void defaultsMatchProductionPolicy() {
        PrecedencePolicy p = PrecedencePolicy.defaults();

        assertEquals(30, p.priorityOverrideDelayMinutes());
        assertEquals(10, p.objectivePriorityWeight());
        assertEquals(Duration.ofMinutes(5), p.waitPerRank());
        assertEquals(10, p.maxCreditedDelayMinutes());
        assertEquals(20.0, p.throughputScalePercent());
        assertEquals(20, p.confidenceSaturationTrains());
        assertEquals(0.9, p.solvedProceedConfidence());
        assertEquals(0.8, p.solvedWaitConfidence());
        assertEquals(0.6, p.heuristicProceedConfidence());
        assertEquals(0.5, p.heuristicWaitConfidence());
        assertEquals(0.3, p.degradedConfidence());
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new PrecedencePolicy(
                30, 10, Duration.ofMinutes(5), 10, 20.0, 20, 1.5, 0.8, 0.6, 0.5, 0.3));
    }

    @Test
    void rejectsZeroSaturation() {
        assertThrows(IllegalArgumentException.class, () -> new PrecedencePolicy(
                30, 10, Duration.ofMinutes(5), 10, 20.0, 0, 0.9, 0.8, 0.6, 0.5, 0.3));
    }

    @Test
    void rejectsNegativeWait() {
        assertThrows(IllegalArgumentException.class, () -> new PrecedencePolicy(
                30, 10, Duration.ofMinutes(-1), 10, 20.0, 20, 0.9, 0.8, 0.6, 0.5, 0.3));
    }
}
