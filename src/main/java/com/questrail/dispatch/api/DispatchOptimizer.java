package com.questrail.dispatch.api;

import com.questrail.dispatch.model.OptimizationResult;
import com.questrail.dispatch.model.SystemState;

/**
 * DispatchOptimizer
 * -----------------------------------------------------------------------------
 * {@code DispatchOptimizer} is the single boundary between the precedence
 * decision engine and the systems around it (REST endpoints, persistence,
 * dashboards, simulators).
 *
 * <h2>Core Responsibilities</h2>
 * Given one snapshot of the network, a {@code DispatchOptimizer}:
 * <ul>
 *   <li>decides which trains may proceed onto their section now</li>
 *   <li>decides which trains must wait, and roughly for how long</li>
 *   <li>reports expected delay reduction, throughput gain and confidence</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>building the snapshot (loading trains, sections, stations)</li>
 *   <li>persisting or displaying results</li>
 *   <li>applying decisions to trains or marking them applied</li>
 *   <li>retrying failed passes</li>
 * </ul>
 *
 * <h2>Totality</h2>
 * {@link #optimize(SystemState)} never throws for a well-formed snapshot.
 * Reduced quality is reported through the result's confidence score, reason
 * strings and {@link OptimizationOutcome}, never through an exception.
 *
 * <h2>Threading and Concurrency</h2>
 * Implementations hold no mutable state across calls. Concurrent callers may
 * share one instance as long as each supplies its own snapshot.
 *
 * <h2>Determinism</h2>
 * Equal snapshots yield equivalent decisions. Exact equality across runs is
 * not guaranteed when the solver finds several equally good orders.
 */
public interface DispatchOptimizer
{
    /**
     * Runs one synchronous decision pass over {@code state}.
     *
     * @param state network snapshot (must not be {@code null})
     * @return the decisions and metrics for this snapshot
     */
    OptimizationResult optimize(SystemState state);
}
