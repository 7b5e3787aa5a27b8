package com.questrail.dispatch.conflict;

import com.questrail.dispatch.model.Train;

/**
 * ConflictDetector
 * -----------------------------------------------------------------------------
 * Decides whether two trains contend for the same scarce resource.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Symmetric: {@code competesForResource(a, b) == competesForResource(b, a)}</li>
 *   <li>Side-effect free</li>
 *   <li>A train never conflicts with itself</li>
 * </ul>
 *
 * The precedence solver forces an ordering only between conflicting trains.
 * Widening the conflict definition (e.g. to adjacent sections) without also
 * adding a binding capacity constraint would change which orders are feasible;
 * see {@code PrecedenceModel#overCapacitySections()}.
 */
public interface ConflictDetector
{
    boolean competesForResource(Train a, Train b);
}
