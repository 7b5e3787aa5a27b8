package com.questrail.dispatch.api;

/**
 * OptimizationOutcome
 * -----------------------------------------------------------------------------
 * Which terminal path of the optimizer produced a result.
 * <p>
 * Quality is also visible through confidence scores and reason strings; this
 * enum lets collaborators branch on it without parsing text.
 */
public enum OptimizationOutcome
{
    /** No train needed a decision. */
    TRIVIAL,

    /** The constraint solver found an optimal or feasible precedence order. */
    SOLVED,

    /**
     * The solver returned no usable assignment within its time budget and the
     * priority/delay sort was used instead.
     */
    HEURISTIC,

    /**
     * An unexpected failure occurred; every active train was told to proceed
     * with caution.
     */
    DEGRADED
}
