package com.questrail.dispatch.solver;

import com.questrail.dispatch.model.Train;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * PrecedenceOrder
 * -----------------------------------------------------------------------------
 * Ranked list of trains, rank 0 first.
 *
 * <p>A train's rank is the number of other trains ordered strictly before it.
 * Several trains may share a rank (e.g. rank 0 on different sections).
 * {@link #entries()} is sorted by rank; trains of equal rank keep the order
 * they were supplied in.</p>
 */
public final class PrecedenceOrder
{
    /**
     * How the order was produced.
     */
    public enum Basis {
        /** Read from a solver assignment. */
        SOLVED,
        /** Priority/delay sort. */
        HEURISTIC
    }

    public record RankedTrain(Train train, int rank) {
        public RankedTrain {
            Objects.requireNonNull(train, "train");
            if (rank < 0) {
                throw new IllegalArgumentException("rank must be non-negative");
            }
        }
    }

    private final List<RankedTrain> entries;
    private final Basis basis;

    private PrecedenceOrder(List<RankedTrain> entries, Basis basis) {
        List<RankedTrain> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(RankedTrain::rank));
        this.entries = List.copyOf(sorted);
        this.basis = Objects.requireNonNull(basis, "basis");
    }

    /**
     * Builds an order from a pairwise relation.
     *
     * @param trains trains in model index order
     * @param before {@code before[i][j]} is true if train i is ordered before train j
     */
    public static PrecedenceOrder fromRelation(List<Train> trains, boolean[][] before) {
        Objects.requireNonNull(trains, "trains");
        Objects.requireNonNull(before, "before");
        final int n = trains.size();
        if (before.length != n) {
            throw new IllegalArgumentException("relation size " + before.length + " != train count " + n);
        }

        List<RankedTrain> ranked = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int rank = 0;
            for (int j = 0; j < n; j++) {
                if (i != j && before[j][i]) {
                    rank++;
                }
            }
            ranked.add(new RankedTrain(trains.get(i), rank));
        }
        return new PrecedenceOrder(ranked, Basis.SOLVED);
    }

    /**
     * Returns true if {@code before} contains a cycle, including two trains
     * each ordered before the other. Such a relation has no first train.
     */
    public static boolean hasCycle(boolean[][] before) {
        Objects.requireNonNull(before, "before");
        final int n = before.length;

        int[] incoming = new int[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j && before[i][j]) {
                    incoming[j]++;
                }
            }
        }

        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (incoming[i] == 0) {
                ready.add(i);
            }
        }

        int visited = 0;
        while (!ready.isEmpty()) {
            int i = ready.poll();
            visited++;
            for (int j = 0; j < n; j++) {
                if (i != j && before[i][j] && --incoming[j] == 0) {
                    ready.add(j);
                }
            }
        }
        return visited < n;
    }

    /**
     * Builds an order in which each train's rank is its position in {@code sequence}.
     */
    public static PrecedenceOrder fromSequence(List<Train> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        List<RankedTrain> ranked = new ArrayList<>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            ranked.add(new RankedTrain(sequence.get(i), i));
        }
        return new PrecedenceOrder(ranked, Basis.HEURISTIC);
    }

    public List<RankedTrain> entries() {
        return entries;
    }

    public Basis basis() {
        return basis;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
