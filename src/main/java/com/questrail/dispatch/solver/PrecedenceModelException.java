package com.questrail.dispatch.solver;

/**
 * Indicates that a set of trains could not be turned into a precedence model.
 *
 * This typically reflects:
 * <ul>
 *   <li>The same train identity appearing twice</li>
 *   <li>A train without a current section being offered for ordering</li>
 * </ul>
 */
public final class PrecedenceModelException extends RuntimeException
{
    public PrecedenceModelException(String message) {
        super(message);
    }
}
