package com.questrail.dispatch.core;

/**
 * OptimizerStage
 * -----------------------------------------------------------------------------
 * States of one optimization pass.
 *
 * <pre>
 *   IDLE -> FILTERING -> SOLVING -> EXTRACTING -> SCORING -> DONE
 *             |            |           |            |
 *             +------------+-----------+------------+--> FALLBACK_DONE
 * </pre>
 *
 * FILTERING may also go straight to DONE when no train needs a decision.
 * SOLVING runs on one of two paths, see {@link SolvePath}.
 */
public enum OptimizerStage
{
    IDLE,
    FILTERING,
    SOLVING,
    EXTRACTING,
    SCORING,
    DONE,
    FALLBACK_DONE;

    public boolean isTerminal() {
        return this == DONE || this == FALLBACK_DONE;
    }
}
