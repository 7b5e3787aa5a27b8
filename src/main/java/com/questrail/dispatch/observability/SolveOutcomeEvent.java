package com.questrail.dispatch.observability;

import com.questrail.dispatch.core.SolvePath;

import java.time.Instant;

/**
 * Record describing how the SOLVING stage concluded.
 *
 * @param trainCount       trains in the model
 * @param exclusivePairs   conflicting pairs
 * @param forcedPairs      pairs fixed by priority
 * @param overCapacity     sections holding more modelled trains than tracks
 * @param solverStatus     status reported by the solver
 * @param path             ordering path taken
 * @param solveSeconds     seconds reported by the solver
 */
public record SolveOutcomeEvent(
    Instant timestamp,
    int trainCount,
    int exclusivePairs,
    int forcedPairs,
    int overCapacity,
    String solverStatus,
    SolvePath path,
    double solveSeconds
) {
    public boolean isHeuristicFallback() {
        return path == SolvePath.HEURISTIC;
    }
}
