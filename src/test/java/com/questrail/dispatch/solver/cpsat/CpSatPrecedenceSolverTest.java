package com.questrail.dispatch.solver.cpsat;

import com.questrail.dispatch.NetworkFixtures;
import com.questrail.dispatch.config.OptimizerConfig;
import com.questrail.dispatch.config.PrecedencePolicy;
import com.questrail.dispatch.conflict.SameSectionConflictDetector;
import com.questrail.dispatch.model.Section;
import com.questrail.dispatch.model.SystemState;
import com.questrail.dispatch.model.Train;
import com.questrail.dispatch.model.TrainType;
import com.questrail.dispatch.solver.PrecedenceModel;
import com.questrail.dispatch.solver.PrecedenceOrder;
import com.questrail.dispatch.solver.SolveOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CpSatPrecedenceSolverTest
 * -----------------------------------------------------------------------------
 * Runs the real CP-SAT solver on small models.
 */
class CpSatPrecedenceSolverTest {

    private final CpSatPrecedenceSolver solver = new CpSatPrecedenceSolver(
            OptimizerConfig.builder().withTimeLimit(Duration.ofSeconds(10)).build());

    private static PrecedenceModel model(List<Train> trains, List<Section> sections) {
        SystemState state = NetworkFixtures.snapshot(trains, sections);
        return PrecedenceModel.build(trains, state, SameSectionConflictDetector.INSTANCE, PrecedencePolicy.defaults());
    }

    private static PrecedenceOrder solved(SolveOutcome outcome) {
        assertInstanceOf(SolveOutcome.Solved.class, outcome, "solver status " + outcome.solverStatus());
        return ((SolveOutcome.Solved) outcome).order();
    }

    private static int rankOf(PrecedenceOrder order, Train train) {
        for (PrecedenceOrder.RankedTrain entry : order.entries()) {
            if (entry.train().equals(train)) {
                return entry.rank();
            }
        }
        throw new AssertionError("train missing from order: " + train);
    }

    @Test
    void singleTrainRanksFirst() {
        Section section = NetworkFixtures.singleTrack();
        Train train = NetworkFixtures.running("A", TrainType.EXPRESS, section, 3);

        PrecedenceOrder order = solved(solver.solve(model(List.of(train), List.of(section))));

        assertEquals(PrecedenceOrder.Basis.SOLVED, order.basis());
        assertEquals(0, rankOf(order, train));
    }

    @Test
    void conflictingTrainsAreSerialized() {
        Section section = NetworkFixtures.singleTrack();
        Train a = NetworkFixtures.running("A", TrainType.EXPRESS, section, 0);
        Train b = NetworkFixtures.running("B", TrainType.EXPRESS, section, 5);

        PrecedenceOrder order = solved(solver.solve(model(List.of(a, b), List.of(section))));

        assertEquals(Set.of(0, 1), Set.of(rankOf(order, a), rankOf(order, b)));
    }

    @Test
    void higherPriorityWinsBelowOverrideThreshold() {
        Section section = NetworkFixtures.singleTrack();
        Train freight = NetworkFixtures.running("F", TrainType.FREIGHT, section, 20);
        Train express = NetworkFixtures.running("E", TrainType.EXPRESS, section, 0);

        PrecedenceOrder order = solved(solver.solve(model(List.of(freight, express), List.of(section))));

        assertEquals(0, rankOf(order, express));
        assertEquals(1, rankOf(order, freight));
    }

    @Test
    void priorityChainStaysTransitiveAcrossDelayOverride() {
        // special->express and express->passenger are forced; special vs
        // passenger is left open by the 40 minute delay gap
        Section section = NetworkFixtures.singleTrack();
        Train special = NetworkFixtures.running("S", TrainType.SPECIAL, section, 0);
        Train express = NetworkFixtures.running("E", TrainType.EXPRESS, section, 20);
        Train passenger = NetworkFixtures.running("P", TrainType.PASSENGER, section, 40);

        PrecedenceOrder order = solved(solver.solve(
                model(List.of(passenger, express, special), List.of(section))));

        assertEquals(0, rankOf(order, special));
        assertEquals(1, rankOf(order, express));
        assertEquals(2, rankOf(order, passenger));
    }

    @Test
    void reportsSolverStatusAndTime() {
        Section section = NetworkFixtures.singleTrack();
        Train train = NetworkFixtures.running("A", TrainType.PASSENGER, section, 0);

        SolveOutcome outcome = solver.solve(model(List.of(train), List.of(section)));

        assertTrue(outcome.solverStatus().equals("OPTIMAL") || outcome.solverStatus().equals("FEASIBLE"),
                outcome.solverStatus());
        assertTrue(outcome.solveSeconds() >= 0.0);
    }

    @Test
    void everyTrainIsRanked() {
        SystemState corridor = NetworkFixtures.corridor();
        PrecedenceModel model = PrecedenceModel.build(corridor.eligibleTrains(), corridor,
                SameSectionConflictDetector.INSTANCE, PrecedencePolicy.defaults());

        PrecedenceOrder order = solved(solver.solve(model));

        assertEquals(corridor.eligibleTrains().size(), order.size());
        for (Train train : corridor.eligibleTrains()) {
            assertTrue(rankOf(order, train) >= 0);
        }
    }
}
