package com.questrail.dispatch.solver;

import com.questrail.dispatch.NetworkFixtures;
import com.questrail.dispatch.model.Section;
import com.questrail.dispatch.model.Train;
import com.questrail.dispatch.model.TrainType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrecedenceOrderTest {

    private final Section section = NetworkFixtures.singleTrack();
    private final Train a = NetworkFixtures.running("A", TrainType.EXPRESS, section, 0);
    private final Train b = NetworkFixtures.running("B", TrainType.EXPRESS, section, 0);
    private final Train c = NetworkFixtures.running("C", TrainType.EXPRESS, section, 0);

    @Test
    void rankCountsTrainsOrderedBefore() {
        // c before a, c before b, a before b
        boolean[][] before = new boolean[3][3];
        before[2][0] = true;
        before[2][1] = true;
        before[0][1] = true;

        PrecedenceOrder order = PrecedenceOrder.fromRelation(List.of(a, b, c), before);

        assertEquals(PrecedenceOrder.Basis.SOLVED, order.basis());
        assertEquals(List.of(
                new PrecedenceOrder.RankedTrain(c, 0),
                new PrecedenceOrder.RankedTrain(a, 1),
                new PrecedenceOrder.RankedTrain(b, 2)), order.entries());
    }

    @Test
    void unrelatedTrainsShareRankZeroInInputOrder() {
        PrecedenceOrder order = PrecedenceOrder.fromRelation(List.of(a, b, c), new boolean[3][3]);

        assertEquals(3, order.size());
        for (PrecedenceOrder.RankedTrain entry : order.entries()) {
            assertEquals(0, entry.rank());
        }
        assertEquals(List.of(a, b, c), order.entries().stream().map(PrecedenceOrder.RankedTrain::train).toList());
    }

    @Test
    void sequencePositionIsRank() {
        PrecedenceOrder order = PrecedenceOrder.fromSequence(List.of(b, c, a));

        assertEquals(PrecedenceOrder.Basis.HEURISTIC, order.basis());
        assertEquals(new PrecedenceOrder.RankedTrain(b, 0), order.entries().get(0));
        assertEquals(new PrecedenceOrder.RankedTrain(a, 2), order.entries().get(2));
    }

    @Test
    void threeWayCycleIsDetected() {
        boolean[][] before = new boolean[3][3];
        before[0][1] = true;
        before[1][2] = true;
        before[2][0] = true;

        assertTrue(PrecedenceOrder.hasCycle(before));
    }

    @Test
    void mutualPairIsACycle() {
        boolean[][] before = new boolean[2][2];
        before[0][1] = true;
        before[1][0] = true;

        assertTrue(PrecedenceOrder.hasCycle(before));
    }

    @Test
    void chainAndEmptyRelationAreAcyclic() {
        boolean[][] chain = new boolean[3][3];
        chain[0][1] = true;
        chain[1][2] = true;
        chain[0][2] = true;

        assertFalse(PrecedenceOrder.hasCycle(chain));
        assertFalse(PrecedenceOrder.hasCycle(new boolean[4][4]));
        assertFalse(PrecedenceOrder.hasCycle(new boolean[0][0]));
    }

    @Test
    void relationMustMatchTrainCount() {
        assertThrows(IllegalArgumentException.class,
                () -> PrecedenceOrder.fromRelation(List.of(a, b), new boolean[3][3]));
    }

    @Test
    void emptySequenceIsEmpty() {
        assertTrue(PrecedenceOrder.fromSequence(List.of()).isEmpty());
    }
}
