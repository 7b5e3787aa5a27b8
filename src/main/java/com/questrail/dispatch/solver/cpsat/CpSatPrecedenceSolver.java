package com.questrail.dispatch.solver.cpsat;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.questrail.dispatch.config.OptimizerConfig;
import com.questrail.dispatch.solver.PrecedenceModel;
import com.questrail.dispatch.solver.PrecedenceOrder;
import com.questrail.dispatch.solver.PrecedenceSolver;
import com.questrail.dispatch.solver.SolveOutcome;

import java.util.Objects;

/**
 * CpSatPrecedenceSolver
 * -----------------------------------------------------------------------------
 * {@link PrecedenceSolver} backed by the OR-Tools CP-SAT solver.
 *
 * <h2>Translation</h2>
 * <ul>
 *   <li>one {@link BoolVar} {@code before_i_j} per ordered pair</li>
 *   <li>{@code before_i_j + before_j_i == 1} per exclusive pair</li>
 *   <li>{@code before_i_j == 1} per forced pair</li>
 *   <li>{@code before_i_j + before_j_k - before_i_k <= 1} per triple of
 *       mutually conflicting trains</li>
 *   <li>a {@code total_delay} variable pinned to the weighted delay sum and
 *       minimized</li>
 * </ul>
 * Unconstrained variables are hinted to 0 so that trains on unrelated
 * sections are not ranked behind each other without reason. Hints do not
 * restrict the search, so an assignment that still contains a cycle is
 * reported as {@link SolveOutcome.NoSolution} with status {@value #CYCLIC_STATUS}.
 *
 * <h2>Scope</h2>
 * A fresh {@link CpModel} and {@link CpSolver} are created per call. Nothing
 * solver-related outlives {@link #solve(PrecedenceModel)}.
 */
public final class CpSatPrecedenceSolver implements PrecedenceSolver
{
    /** Status reported when the assignment does not form an order. */
    public static final String CYCLIC_STATUS = "CYCLIC";

    private final OptimizerConfig config;

    public CpSatPrecedenceSolver(OptimizerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public SolveOutcome solve(PrecedenceModel model) {
        Objects.requireNonNull(model, "model");
        OrToolsNatives.ensureLoaded();

        final int n = model.size();
        CpModel cp = new CpModel();

        BoolVar[][] before = new BoolVar[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    before[i][j] = cp.newBoolVar("before_" + i + "_" + j);
                }
            }
        }

        for (PrecedenceModel.OrderedPair pair : model.exclusivePairs()) {
            int i = pair.first();
            int j = pair.second();
            cp.addEquality(LinearExpr.sum(new BoolVar[] {before[i][j], before[j][i]}), 1);
        }

        for (PrecedenceModel.OrderedPair pair : model.forcedPairs()) {
            cp.addEquality(before[pair.first()][pair.second()], 1);
        }

        for (PrecedenceModel.OrderedTriple t : model.transitiveTriples()) {
            BoolVar[] chain = {
                    before[t.first()][t.middle()],
                    before[t.middle()][t.last()],
                    before[t.first()][t.last()]
            };
            cp.addLessOrEqual(LinearExpr.weightedSum(chain, new long[] {1, 1, -1}), 1);
        }

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j && model.isUnconstrained(i, j)) {
                    cp.addHint(before[i][j], 0);
                }
            }
        }

        long weightedDelay = model.objectiveValue();
        IntVar totalDelay = cp.newIntVar(0, Math.max(0L, weightedDelay), "total_delay");
        cp.addEquality(totalDelay, weightedDelay);
        cp.minimize(totalDelay);

        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(config.timeLimitSeconds());
        solver.getParameters().setNumSearchWorkers(config.searchWorkers());
        solver.getParameters().setLogSearchProgress(false);

        CpSolverStatus status = solver.solve(cp);
        double seconds = Math.max(0.0, solver.wallTime());

        if (status != CpSolverStatus.OPTIMAL && status != CpSolverStatus.FEASIBLE) {
            return new SolveOutcome.NoSolution(status.name(), seconds);
        }

        boolean[][] relation = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    relation[i][j] = solver.booleanValue(before[i][j]);
                }
            }
        }

        // Pairs on different sections are free and only hinted.
        if (PrecedenceOrder.hasCycle(relation)) {
            return new SolveOutcome.NoSolution(CYCLIC_STATUS, seconds);
        }

        PrecedenceOrder order = PrecedenceOrder.fromRelation(model.trains(), relation);
        return new SolveOutcome.Solved(order, status.name(), seconds);
    }
}
