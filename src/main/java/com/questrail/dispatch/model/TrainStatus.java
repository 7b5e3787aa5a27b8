package com.questrail.dispatch.model;

/**
 * Operational status of a train at snapshot time.
 * <p>
 * Only {@link #RUNNING} and {@link #DELAYED} trains are candidates for a
 * precedence decision.
 */
public enum TrainStatus
{
    ON_TIME,
    DELAYED,
    CANCELLED,
    RUNNING,
    STOPPED;

    /**
     * Returns true if a train in this status is moving through the network and
     * therefore needs a proceed/wait decision.
     */
    public boolean isActive() {
        return this == RUNNING || this == DELAYED;
    }
}
