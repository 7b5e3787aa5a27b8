package com.questrail.dispatch.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of creation timestamps for decisions and results.
 *
 * <p>
 * This clock may jump. It MUST NOT be used to measure computation time; use
 * {@link MonotonicClock} for that.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
