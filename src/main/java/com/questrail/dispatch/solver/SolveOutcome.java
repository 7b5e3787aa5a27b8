package com.questrail.dispatch.solver;

import java.util.Objects;

/**
 * SolveOutcome
 * -----------------------------------------------------------------------------
 * Result of one bounded solve.
 *
 * <p>Running out of time or proving the model infeasible is an ordinary
 * outcome ({@link NoSolution}), not an error. Only genuine failures (native
 * library problems, binding errors) surface as exceptions.</p>
 */
public sealed interface SolveOutcome
        permits SolveOutcome.Solved, SolveOutcome.NoSolution
{
    /**
     * Solver status name as reported by the solver, e.g. {@code "OPTIMAL"}.
     */
    String solverStatus();

    /**
     * Wall-clock seconds the solver reports having spent.
     */
    double solveSeconds();

    /**
     * The solver certified an optimal or feasible assignment.
     */
    record Solved(PrecedenceOrder order, String solverStatus, double solveSeconds) implements SolveOutcome {
        public Solved {
            Objects.requireNonNull(order, "order");
            Objects.requireNonNull(solverStatus, "solverStatus");
        }
    }

    /**
     * The solver stopped without a usable assignment: infeasible, invalid
     * model, time budget exhausted, or an assignment that is not an order.
     */
    record NoSolution(String solverStatus, double solveSeconds) implements SolveOutcome {
        public NoSolution {
            Objects.requireNonNull(solverStatus, "solverStatus");
        }
    }
}
