package com.questrail.dispatch.model;

/**
 * What a {@link Decision} tells a train to do.
 * <p>
 * The precedence engine only emits {@link #PROCEED} and {@link #WAIT}.
 * {@link #REROUTE} and {@link #CROSS} exist so that stored decisions from other
 * producers can be represented.
 */
public enum DecisionAction
{
    PROCEED("proceed"),
    WAIT("wait"),
    REROUTE("reroute"),
    CROSS("cross");

    private final String code;

    DecisionAction(String code) {
        this.code = code;
    }

    /**
     * External lowercase code, e.g. {@code "proceed"}.
     */
    public String code() {
        return code;
    }
}
