package com.questrail.dispatch.solver;

/**
 * PrecedenceSolver
 * -----------------------------------------------------------------------------
 * Finds an assignment for a {@link PrecedenceModel} within a time budget.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Must return within the configured budget plus solver overhead</li>
 *   <li>Must not keep state between calls; every solve is request-scoped</li>
 *   <li>Returns {@link SolveOutcome.NoSolution} for infeasibility and timeout</li>
 *   <li>May throw for unexpected failures; the caller degrades</li>
 * </ul>
 */
public interface PrecedenceSolver
{
    SolveOutcome solve(PrecedenceModel model);
}
