package com.questrail.dispatch.solver;

import com.questrail.dispatch.config.PrecedencePolicy;
import com.questrail.dispatch.conflict.ConflictDetector;
import com.questrail.dispatch.model.Section;
import com.questrail.dispatch.model.SystemState;
import com.questrail.dispatch.model.Train;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * PrecedenceModel
 * -----------------------------------------------------------------------------
 * Solver-independent description of the pairwise ordering problem.
 *
 * <h2>Role in the architecture</h2>
 * This class derives every constraint from the snapshot without touching a
 * solver. A {@link PrecedenceSolver} only translates it. Keeping derivation
 * pure makes the constraint rules testable without native libraries.
 *
 * <h2>Variables</h2>
 * For every ordered pair {@code (i, j)}, {@code i != j}, of trains (indexed in
 * {@link #trains()} order) there is one boolean "i before j".
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li><b>Exclusivity</b>: for each conflicting pair exactly one of
 *       "i before j" and "j before i" holds. Non-conflicting pairs are free.</li>
 *   <li><b>Priority dominance</b>: if {@code priority(i) > priority(j)} and
 *       {@code delay(j) - delay(i)} is below the policy override threshold,
 *       "i before j" is forced true. This applies to every pair, conflicting
 *       or not.</li>
 *   <li><b>Transitivity</b>: among mutually conflicting trains, "i before j"
 *       and "j before k" imply "i before k".</li>
 *   <li><b>Capacity</b>: trains are grouped by section and over-capacity
 *       sections are reported, but no capacity constraint is added. The
 *       exclusivity, priority and transitivity constraints alone serialize
 *       same-section trains.</li>
 * </ul>
 *
 * <h2>Objective</h2>
 * Minimize {@code sum(priority(t) * weight * delay(t))}. Every term is fixed
 * by the snapshot, so the objective value is a constant; the solver's job is
 * to certify a feasible assignment.
 */
public final class PrecedenceModel
{
    /**
     * "first before second", by index into {@link #trains()}.
     */
    public record OrderedPair(int first, int second) {
        public OrderedPair {
            if (first == second) {
                throw new IllegalArgumentException("pair must reference two different trains");
            }
        }
    }

    /**
     * Three mutually conflicting trains, by index into {@link #trains()}.
     * "first before middle" and "middle before last" imply "first before last".
     */
    public record OrderedTriple(int first, int middle, int last) {
        public OrderedTriple {
            if (first == middle || middle == last || first == last) {
                throw new IllegalArgumentException("triple must reference three different trains");
            }
        }
    }

    private final List<Train> trains;
    private final List<OrderedPair> exclusivePairs;
    private final List<OrderedTriple> transitiveTriples;
    private final List<OrderedPair> forcedPairs;
    private final Set<OrderedPair> exclusiveLookup;
    private final Set<OrderedPair> forcedLookup;
    private final Map<UUID, List<Integer>> sectionGroups;
    private final Set<UUID> overCapacitySections;
    private final long[] objectiveWeights;
    private final long objectiveValue;

    private PrecedenceModel(List<Train> trains,
                            List<OrderedPair> exclusivePairs,
                            List<OrderedPair> forcedPairs,
                            List<OrderedTriple> transitiveTriples,
                            Map<UUID, List<Integer>> sectionGroups,
                            Set<UUID> overCapacitySections,
                            long[] objectiveWeights) {
        this.trains = List.copyOf(trains);
        this.exclusivePairs = List.copyOf(exclusivePairs);
        this.forcedPairs = List.copyOf(forcedPairs);
        this.transitiveTriples = List.copyOf(transitiveTriples);
        this.exclusiveLookup = new HashSet<>(exclusivePairs);
        this.forcedLookup = new HashSet<>(forcedPairs);
        this.sectionGroups = Collections.unmodifiableMap(sectionGroups);
        this.overCapacitySections = Collections.unmodifiableSet(overCapacitySections);
        this.objectiveWeights = objectiveWeights;

        long total = 0L;
        for (int i = 0; i < trains.size(); i++) {
            total = Math.addExact(total, Math.multiplyExact(objectiveWeights[i], trains.get(i).delayMinutes()));
        }
        this.objectiveValue = total;
    }

    /**
     * Derives the model for {@code trains}.
     *
     * @param trains   trains to order; each must hold a section
     * @param state    snapshot used to resolve section capacity
     * @param detector conflict definition
     * @param policy   override threshold and objective weight
     * @throws PrecedenceModelException if a train repeats or holds no section
     */
    public static PrecedenceModel build(List<Train> trains,
                                        SystemState state,
                                        ConflictDetector detector,
                                        PrecedencePolicy policy) {
        Objects.requireNonNull(trains, "trains");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(detector, "detector");
        Objects.requireNonNull(policy, "policy");

        Set<UUID> seen = new HashSet<>();
        for (Train train : trains) {
            if (!seen.add(train.id())) {
                throw new PrecedenceModelException("Train appears twice: " + train.number());
            }
            if (train.currentSection().isEmpty()) {
                throw new PrecedenceModelException("Train holds no section: " + train.number());
            }
        }

        final int n = trains.size();
        List<OrderedPair> exclusive = new ArrayList<>();
        List<OrderedPair> forced = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            Train a = trains.get(i);
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                Train b = trains.get(j);

                // One entry per unordered conflicting pair.
                if (i < j && detector.competesForResource(a, b)) {
                    exclusive.add(new OrderedPair(i, j));
                }

                if (a.priority() > b.priority()
                        && b.delayMinutes() - a.delayMinutes() < policy.priorityOverrideDelayMinutes()) {
                    forced.add(new OrderedPair(i, j));
                }
            }
        }

        Set<OrderedPair> conflicting = new HashSet<>(exclusive);
        List<OrderedTriple> triples = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j || !conflicting.contains(unordered(i, j))) {
                    continue;
                }
                for (int k = 0; k < n; k++) {
                    if (k != i && k != j
                            && conflicting.contains(unordered(j, k))
                            && conflicting.contains(unordered(i, k))) {
                        triples.add(new OrderedTriple(i, j, k));
                    }
                }
            }
        }

        Map<UUID, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            UUID sectionId = trains.get(i).currentSection().orElseThrow().id();
            groups.computeIfAbsent(sectionId, k -> new ArrayList<>()).add(i);
        }

        Set<UUID> overCapacity = new LinkedHashSet<>();
        for (Map.Entry<UUID, List<Integer>> group : groups.entrySet()) {
            Section section = state.findSection(group.getKey())
                    .orElseGet(() -> trains.get(group.getValue().get(0)).currentSection().orElseThrow());
            if (group.getValue().size() > section.tracks()) {
                overCapacity.add(group.getKey());
            }
        }
        for (Map.Entry<UUID, List<Integer>> group : groups.entrySet()) {
            group.setValue(List.copyOf(group.getValue()));
        }

        long[] weights = new long[n];
        for (int i = 0; i < n; i++) {
            weights[i] = (long) trains.get(i).priority() * policy.objectivePriorityWeight();
        }

        return new PrecedenceModel(trains, exclusive, forced, triples, groups, overCapacity, weights);
    }

    private static OrderedPair unordered(int i, int j) {
        return new OrderedPair(Math.min(i, j), Math.max(i, j));
    }

    public List<Train> trains() {
        return trains;
    }

    public int size() {
        return trains.size();
    }

    /**
     * Conflicting pairs, one entry per unordered pair with {@code first < second}.
     */
    public List<OrderedPair> exclusivePairs() {
        return exclusivePairs;
    }

    /**
     * Every ordered triple of mutually conflicting trains. Ordering within a
     * conflict group must be transitive, otherwise forced pairs and a free
     * exclusive pair can close a cycle in which no train ranks first.
     */
    public List<OrderedTriple> transitiveTriples() {
        return transitiveTriples;
    }

    /**
     * Pairs whose order is fixed by priority.
     */
    public List<OrderedPair> forcedPairs() {
        return forcedPairs;
    }

    public boolean isExclusive(int i, int j) {
        return exclusiveLookup.contains(unordered(i, j));
    }

    public boolean isForced(int first, int second) {
        return forcedLookup.contains(new OrderedPair(first, second));
    }

    /**
     * Returns true if neither exclusivity nor priority constrains "i before j".
     */
    public boolean isUnconstrained(int i, int j) {
        return !isExclusive(i, j) && !isForced(i, j) && !isForced(j, i);
    }

    /**
     * Train indices grouped by the section they occupy, in first-seen order.
     */
    public Map<UUID, List<Integer>> sectionGroups() {
        return sectionGroups;
    }

    /**
     * Sections holding more of the modelled trains than they have tracks.
     * <p>
     * Reported only. No constraint is derived from this set.
     */
    public Set<UUID> overCapacitySections() {
        return overCapacitySections;
    }

    /**
     * Objective weight of train {@code i}: priority times the policy weight.
     */
    public long objectiveWeight(int i) {
        return objectiveWeights[i];
    }

    /**
     * Weighted delay sum the solver minimizes.
     */
    public long objectiveValue() {
        return objectiveValue;
    }
}
