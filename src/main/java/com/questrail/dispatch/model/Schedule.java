package com.questrail.dispatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A train's planned calling pattern.
 * <p>
 * {@code stations}, {@code arrivalTimes} and {@code departureTimes} are
 * parallel lists. {@code sectionSequence} lists the sections the train runs
 * over, in order.
 */
public record Schedule(
        UUID id,
        Train train,
        List<Station> stations,
        List<Instant> arrivalTimes,
        List<Instant> departureTimes,
        List<Section> sectionSequence
) {
    public Schedule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(train, "train");
        stations = List.copyOf(Objects.requireNonNull(stations, "stations"));
        arrivalTimes = List.copyOf(Objects.requireNonNull(arrivalTimes, "arrivalTimes"));
        departureTimes = List.copyOf(Objects.requireNonNull(departureTimes, "departureTimes"));
        sectionSequence = List.copyOf(Objects.requireNonNull(sectionSequence, "sectionSequence"));

        if (arrivalTimes.size() != stations.size() || departureTimes.size() != stations.size()) {
            throw new IllegalArgumentException("arrival/departure times must align with stations");
        }
    }

    /**
     * Station after {@code current}, or empty if {@code current} is the last
     * stop or not on this schedule.
     */
    public Optional<Station> nextStation(Station current) {
        int index = stations.indexOf(current);
        if (index < 0 || index >= stations.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(stations.get(index + 1));
    }

    /**
     * Section leading from {@code current} to the next scheduled station.
     */
    public Optional<Section> sectionToNextStation(Station current) {
        Optional<Station> next = nextStation(current);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Station to = next.get();
        for (Section section : sectionSequence) {
            if (section.fromStation().equals(current) && section.toStation().equals(to)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
