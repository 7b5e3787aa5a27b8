package com.questrail.dispatch.core;

/**
 * Which ordering path the SOLVING stage ended on.
 */
public enum SolvePath
{
    /** Order read from a certified constraint-solver assignment. */
    CP,

    /** Priority/delay sort after the solver returned no assignment. */
    HEURISTIC
}
