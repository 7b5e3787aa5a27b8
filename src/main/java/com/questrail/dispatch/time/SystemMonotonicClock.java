package com.questrail.dispatch.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Not affected by NTP or manual clock changes. Thread-safe.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
