package com.questrail.dispatch.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for measuring how long an optimization pass took.
 *
 * <h2>Binding invariant</h2>
 * Elapsed computation time MUST be measured with a monotonic source so that
 * a wall-clock adjustment mid-pass can never yield a negative duration.
 * Wall-clock time is used only for timestamps on decisions and results.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
