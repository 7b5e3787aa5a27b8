package com.questrail.dispatch.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable station reference data.
 * <p>
 * Stations are created and maintained by collaborators outside the decision
 * engine; the engine only reads them. Equality is by {@link #id()}.
 *
 * @param id        identity
 * @param name      display name
 * @param code      unique short code, e.g. {@code "BCT"}
 * @param latitude  WGS84 latitude in degrees
 * @param longitude WGS84 longitude in degrees
 * @param platforms number of platforms (at least 1)
 * @param junction  whether lines diverge at this station
 */
public record Station(
        UUID id,
        String name,
        String code,
        double latitude,
        double longitude,
        int platforms,
        boolean junction
) {
    public Station {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(code, "code");
        if (platforms < 1) {
            throw new IllegalArgumentException("platforms must be >= 1");
        }
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }

    /**
     * Creates a non-junction station with a fresh identity.
     */
    public static Station of(String name, String code, double latitude, double longitude, int platforms) {
        return new Station(UUID.randomUUID(), name, code, latitude, longitude, platforms, false);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Station other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Station[" + code + "]";
    }
}
