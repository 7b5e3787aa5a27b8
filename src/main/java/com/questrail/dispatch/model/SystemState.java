package com.questrail.dispatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * SystemState
 * -----------------------------------------------------------------------------
 * Read-only snapshot of the network handed to the optimizer.
 *
 * <h2>Lifecycle</h2>
 * A collaborator builds a fresh snapshot for every optimization call. The
 * engine never mutates it; lists are defensively copied on construction.
 *
 * <h2>Lookups</h2>
 * Lookups by identity are linear scans. Snapshots are small and built once
 * per call, so no index is kept.
 */
public record SystemState(
        Instant timestamp,
        List<Train> trains,
        List<Section> sections,
        List<Station> stations,
        List<Decision> activeDecisions
) {
    public SystemState {
        Objects.requireNonNull(timestamp, "timestamp");
        trains = List.copyOf(Objects.requireNonNull(trains, "trains"));
        sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
        stations = List.copyOf(Objects.requireNonNull(stations, "stations"));
        activeDecisions = List.copyOf(Objects.requireNonNull(activeDecisions, "activeDecisions"));
    }

    public static SystemState of(Instant timestamp, List<Train> trains, List<Section> sections, List<Station> stations) {
        return new SystemState(timestamp, trains, sections, stations, List.of());
    }

    public Optional<Train> findTrain(UUID id) {
        for (Train train : trains) {
            if (train.id().equals(id)) {
                return Optional.of(train);
            }
        }
        return Optional.empty();
    }

    public Optional<Section> findSection(UUID id) {
        for (Section section : sections) {
            if (section.id().equals(id)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    public Optional<Station> findStation(UUID id) {
        for (Station station : stations) {
            if (station.id().equals(id)) {
                return Optional.of(station);
            }
        }
        return Optional.empty();
    }

    /**
     * Trains in status running or delayed, regardless of position.
     */
    public List<Train> activeTrains() {
        return trains.stream()
                .filter(t -> t.status().isActive())
                .toList();
    }

    /**
     * Trains that need a precedence decision: active and holding a section.
     */
    public List<Train> eligibleTrains() {
        return trains.stream()
                .filter(Train::isEligibleForDecision)
                .toList();
    }
}
