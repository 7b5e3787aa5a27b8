package com.questrail.dispatch.decision;

import com.questrail.dispatch.config.PrecedencePolicy;
import com.questrail.dispatch.model.Decision;
import com.questrail.dispatch.model.Train;
import com.questrail.dispatch.solver.PrecedenceOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DecisionExtractor
 * -----------------------------------------------------------------------------
 * Turns a {@link PrecedenceOrder} into one {@link Decision} per train.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>rank 0: proceed onto the train's current section</li>
 *   <li>rank r &gt; 0: wait, no target section, estimated release at
 *       snapshot time + r x wait-per-rank</li>
 * </ul>
 * Reasons and confidences depend on whether the order came from the solver or
 * from the heuristic sort.
 */
public final class DecisionExtractor
{
    static final String SOLVED_PROCEED_REASON = "Highest priority in precedence order";
    static final String HEURISTIC_PROCEED_REASON = "Highest priority by heuristic";

    private final PrecedencePolicy policy;

    public DecisionExtractor(PrecedencePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param order        ranked trains
     * @param snapshotTime time the snapshot was taken; wait estimates count from here
     * @param createdAt    creation timestamp for the decisions
     * @return decisions in rank order
     */
    public List<Decision> extract(PrecedenceOrder order, Instant snapshotTime, Instant createdAt) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(snapshotTime, "snapshotTime");
        Objects.requireNonNull(createdAt, "createdAt");

        final boolean solved = order.basis() == PrecedenceOrder.Basis.SOLVED;
        List<Decision> decisions = new ArrayList<>(order.size());

        for (PrecedenceOrder.RankedTrain entry : order.entries()) {
            Train train = entry.train();
            int rank = entry.rank();

            if (rank == 0) {
                decisions.add(Decision.proceed(
                        train,
                        train.currentSection(),
                        solved ? SOLVED_PROCEED_REASON : HEURISTIC_PROCEED_REASON,
                        solved ? policy.solvedProceedConfidence() : policy.heuristicProceedConfidence(),
                        createdAt));
            } else {
                Instant release = snapshotTime.plus(policy.waitPerRank().multipliedBy(rank));
                decisions.add(Decision.hold(
                        train,
                        Optional.of(release),
                        waitReason(rank),
                        solved ? policy.solvedWaitConfidence() : policy.heuristicWaitConfidence(),
                        createdAt));
            }
        }
        return decisions;
    }

    static String waitReason(int rank) {
        return "Waiting for " + rank + " higher priority trains";
    }
}
