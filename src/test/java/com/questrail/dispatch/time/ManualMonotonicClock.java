package com.questrail.dispatch.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic monotonic clock for tests.
 *
 * - Starts at 0
 * - Advances only when explicitly instructed, or by a fixed step per read
 * - Never goes backwards
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);
    private final long stepPerReadNanos;

    public ManualMonotonicClock() {
        this(0L);
    }

    /**
     * @param stepPerReadNanos amount the clock advances after every read
     */
    public ManualMonotonicClock(long stepPerReadNanos) {
        if (stepPerReadNanos < 0) {
            throw new IllegalArgumentException("step must be non-negative");
        }
        this.stepPerReadNanos = stepPerReadNanos;
    }

    @Override
    public long nowNanos() {
        return nowNanos.getAndAdd(stepPerReadNanos);
    }

    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowNanos.addAndGet(deltaNanos);
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }
}
