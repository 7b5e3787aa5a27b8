package com.questrail.dispatch.solver;

import com.questrail.dispatch.model.Train;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Priority/delay sort used when the solver cannot certify an order in time.
 * <p>
 * Trains are ordered by priority descending, then delay descending, then by
 * identity so that the result does not depend on input order.
 */
public final class HeuristicPrecedenceOrdering
{
    static final Comparator<Train> ORDER = Comparator
            .comparingInt(Train::priority).reversed()
            .thenComparing(Comparator.comparingInt(Train::delayMinutes).reversed())
            .thenComparing(Train::id);

    private HeuristicPrecedenceOrdering() {}

    public static PrecedenceOrder order(List<Train> trains) {
        Objects.requireNonNull(trains, "trains");
        List<Train> sorted = new ArrayList<>(trains);
        sorted.sort(ORDER);
        return PrecedenceOrder.fromSequence(sorted);
    }
}
