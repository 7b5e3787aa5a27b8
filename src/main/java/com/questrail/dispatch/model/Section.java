package com.questrail.dispatch.model;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Section
 * -----------------------------------------------------------------------------
 * A stretch of track between two stations. The section is the scarce resource
 * that trains contend for.
 *
 * <h2>Capacity</h2>
 * {@link #tracks()} is the number of trains the section can hold at once.
 * Occupants are tracked by train identity rather than by {@link Train}
 * reference so that a snapshot never contains a train/section cycle.
 *
 * <h2>Usability invariant</h2>
 * A new train may enter only if:
 * <ul>
 *   <li>status is {@link SectionStatus#AVAILABLE}</li>
 *   <li>occupant count is below {@link #tracks()}</li>
 *   <li>the train's maximum speed does not exceed {@link #maxSpeedKmh()}</li>
 * </ul>
 * See {@link #canAccommodate(Train)}.
 * <p>
 * Equality is by {@link #id()}; two sections with the same identity are the
 * same resource regardless of their other fields.
 *
 * @param id            identity
 * @param fromStation   origin station
 * @param toStation     destination station
 * @param lengthKm      length in kilometres
 * @param maxSpeedKmh   line speed
 * @param tracks        capacity (at least 1)
 * @param status        infrastructure status
 * @param occupantIds   identities of the trains currently on the section
 */
public record Section(
        UUID id,
        Station fromStation,
        Station toStation,
        double lengthKm,
        int maxSpeedKmh,
        int tracks,
        SectionStatus status,
        Set<UUID> occupantIds
) {
    public Section {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fromStation, "fromStation");
        Objects.requireNonNull(toStation, "toStation");
        Objects.requireNonNull(status, "status");
        occupantIds = Set.copyOf(Objects.requireNonNull(occupantIds, "occupantIds"));

        if (lengthKm < 0.0) {
            throw new IllegalArgumentException("lengthKm must be non-negative");
        }
        if (maxSpeedKmh <= 0) {
            throw new IllegalArgumentException("maxSpeedKmh must be positive");
        }
        if (tracks < 1) {
            throw new IllegalArgumentException("tracks must be >= 1");
        }
    }

    /**
     * Creates an empty, available section with a fresh identity.
     */
    public static Section between(Station from, Station to, double lengthKm, int maxSpeedKmh, int tracks) {
        return new Section(UUID.randomUUID(), from, to, lengthKm, maxSpeedKmh, tracks,
                SectionStatus.AVAILABLE, Set.of());
    }

    /**
     * Number of trains currently on the section.
     */
    public int occupantCount() {
        return occupantIds.size();
    }

    /**
     * Returns true if the section is open and has a free track.
     */
    public boolean isAvailable() {
        return status == SectionStatus.AVAILABLE && occupantIds.size() < tracks;
    }

    /**
     * Returns true if the given train could enter this section now.
     */
    public boolean canAccommodate(Train train) {
        Objects.requireNonNull(train, "train");
        return isAvailable() && train.maxSpeedKmh() <= maxSpeedKmh;
    }

    public Section withStatus(SectionStatus newStatus) {
        return new Section(id, fromStation, toStation, lengthKm, maxSpeedKmh, tracks, newStatus, occupantIds);
    }

    public Section withOccupants(Set<UUID> newOccupants) {
        return new Section(id, fromStation, toStation, lengthKm, maxSpeedKmh, tracks, status, newOccupants);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Section other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Section[" + fromStation.code() + "->" + toStation.code()
                + ", tracks=" + tracks + ", status=" + status + "]";
    }
}
