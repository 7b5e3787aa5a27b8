package com.questrail.dispatch.model;

/**
 * Infrastructure status of a {@link Section}.
 */
public enum SectionStatus
{
    AVAILABLE,
    OCCUPIED,
    MAINTENANCE,
    BLOCKED
}
