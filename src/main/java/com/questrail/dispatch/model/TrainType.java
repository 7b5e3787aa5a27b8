package com.questrail.dispatch.model;

import java.util.Locale;
import java.util.Optional;

/**
 * TrainType
 * -----------------------------------------------------------------------------
 * Service category of a train. The category is the <b>only</b> input to a
 * train's priority; see {@link #priority()}.
 *
 * <h2>Priority table</h2>
 * <ul>
 *   <li>{@link #SPECIAL} = 4</li>
 *   <li>{@link #EXPRESS} = 3</li>
 *   <li>{@link #PASSENGER} = 2</li>
 *   <li>{@link #FREIGHT} = 1</li>
 * </ul>
 *
 * Collaborators that carry types as external codes (database rows, JSON) should
 * go through {@link #fromCode(String)} or {@link #priorityForCode(String)}; an
 * unrecognised code is never an error at this layer and ranks lowest.
 */
public enum TrainType
{
    SPECIAL("special", 4),
    EXPRESS("express", 3),
    PASSENGER("passenger", 2),
    FREIGHT("freight", 1);

    /** Priority assigned to any type this enum does not know about. */
    public static final int UNKNOWN_PRIORITY = 1;

    private final String code;
    private final int priority;

    TrainType(String code, int priority) {
        this.code = code;
        this.priority = priority;
    }

    /**
     * External lowercase code, e.g. {@code "express"}.
     */
    public String code() {
        return code;
    }

    /**
     * Fixed priority for this type. Higher wins.
     */
    public int priority() {
        return priority;
    }

    /**
     * Parses an external code, case-insensitively.
     *
     * @return the matching type, or empty for {@code null} / unknown codes
     */
    public static Optional<TrainType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (TrainType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Priority for an external code; unknown codes rank as {@link #UNKNOWN_PRIORITY}.
     */
    public static int priorityForCode(String code) {
        return fromCode(code).map(TrainType::priority).orElse(UNKNOWN_PRIORITY);
    }
}
