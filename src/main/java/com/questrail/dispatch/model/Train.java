package com.questrail.dispatch.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Train
 * -----------------------------------------------------------------------------
 * Immutable per-snapshot view of a train.
 *
 * <h2>Derived priority</h2>
 * A train's priority is computed from its {@link TrainType} when the train is
 * built and cannot be supplied by the caller. The {@link Builder} deliberately
 * has no priority setter, so a train whose priority disagrees with its type
 * cannot be constructed.
 *
 * <h2>Position</h2>
 * A train may be on a section, at a station, both, or neither. Only trains on
 * a section can contend for one.
 * <p>
 * Equality is by {@link #id()}.
 */
public final class Train
{
    private final UUID id;
    private final String number;
    private final String name;
    private final TrainType type;
    private final int priority;
    private final int maxSpeedKmh;
    private final int lengthMeters;
    private final Section currentSection;
    private final Station currentStation;
    private final TrainStatus status;
    private final int delayMinutes;
    private final Instant scheduledDeparture;
    private final Instant actualDeparture;
    private final Instant scheduledArrival;
    private final Instant actualArrival;

    private Train(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID();
        this.number = Objects.requireNonNull(b.number, "number");
        this.name = Objects.requireNonNull(b.name, "name");
        this.type = Objects.requireNonNull(b.type, "type");
        this.priority = type.priority();
        this.maxSpeedKmh = b.maxSpeedKmh;
        this.lengthMeters = b.lengthMeters;
        this.currentSection = b.currentSection;
        this.currentStation = b.currentStation;
        this.status = Objects.requireNonNull(b.status, "status");
        this.delayMinutes = b.delayMinutes;
        this.scheduledDeparture = b.scheduledDeparture;
        this.actualDeparture = b.actualDeparture;
        this.scheduledArrival = b.scheduledArrival;
        this.actualArrival = b.actualArrival;

        if (maxSpeedKmh <= 0) {
            throw new IllegalArgumentException("maxSpeedKmh must be positive");
        }
        if (lengthMeters <= 0) {
            throw new IllegalArgumentException("lengthMeters must be positive");
        }
        if (delayMinutes < 0) {
            throw new IllegalArgumentException("delayMinutes must be non-negative");
        }
    }

    public UUID id() {
        return id;
    }

    public String number() {
        return number;
    }

    public String name() {
        return name;
    }

    public TrainType type() {
        return type;
    }

    /**
     * Priority derived from {@link #type()}. Higher wins.
     */
    public int priority() {
        return priority;
    }

    public int maxSpeedKmh() {
        return maxSpeedKmh;
    }

    public int lengthMeters() {
        return lengthMeters;
    }

    public Optional<Section> currentSection() {
        return Optional.ofNullable(currentSection);
    }

    public Optional<Station> currentStation() {
        return Optional.ofNullable(currentStation);
    }

    public TrainStatus status() {
        return status;
    }

    public int delayMinutes() {
        return delayMinutes;
    }

    public Optional<Instant> scheduledDeparture() {
        return Optional.ofNullable(scheduledDeparture);
    }

    public Optional<Instant> actualDeparture() {
        return Optional.ofNullable(actualDeparture);
    }

    public Optional<Instant> scheduledArrival() {
        return Optional.ofNullable(scheduledArrival);
    }

    public Optional<Instant> actualArrival() {
        return Optional.ofNullable(actualArrival);
    }

    // ---------------------------------------------------------------------
    // Derived properties
    // ---------------------------------------------------------------------

    public boolean isDelayed() {
        return delayMinutes > 0;
    }

    /**
     * Returns true if this train needs a precedence decision: it is running or
     * delayed and currently holds a section.
     */
    public boolean isEligibleForDecision() {
        return status.isActive() && currentSection != null;
    }

    /**
     * Scheduled arrival pushed back by the current delay.
     */
    public Optional<Instant> estimatedArrival() {
        if (scheduledArrival == null) {
            return Optional.empty();
        }
        return Optional.of(scheduledArrival.plus(Duration.ofMinutes(delayMinutes)));
    }

    /**
     * Departure delay in whole minutes, never negative.
     * <p>
     * Returns 0 unless both scheduled and actual departure are known. The
     * {@code now} argument is accepted for callers that evaluate delay at a
     * specific snapshot time; departure delay itself does not depend on it.
     */
    public int calculateDelay(Instant now) {
        Objects.requireNonNull(now, "now");
        if (scheduledDeparture == null || actualDeparture == null) {
            return 0;
        }
        long minutes = Duration.between(scheduledDeparture, actualDeparture).toMinutes();
        return (int) Math.max(0L, minutes);
    }

    /**
     * Returns a builder pre-populated with this train's attributes.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .number(number)
                .name(name)
                .type(type)
                .maxSpeedKmh(maxSpeedKmh)
                .lengthMeters(lengthMeters)
                .currentSection(currentSection)
                .currentStation(currentStation)
                .status(status)
                .delayMinutes(delayMinutes)
                .scheduledDeparture(scheduledDeparture)
                .actualDeparture(actualDeparture)
                .scheduledArrival(scheduledArrival)
                .actualArrival(actualArrival);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Train other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Train[" + number + ", " + type + ", p=" + priority + ", " + status
                + ", delay=" + delayMinutes + "m]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID id;
        private String number;
        private String name;
        private TrainType type;
        private int maxSpeedKmh = 100;
        private int lengthMeters = 400;
        private Section currentSection;
        private Station currentStation;
        private TrainStatus status = TrainStatus.ON_TIME;
        private int delayMinutes;
        private Instant scheduledDeparture;
        private Instant actualDeparture;
        private Instant scheduledArrival;
        private Instant actualArrival;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder number(String number) {
            this.number = number;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(TrainType type) {
            this.type = type;
            return this;
        }

        public Builder maxSpeedKmh(int maxSpeedKmh) {
            this.maxSpeedKmh = maxSpeedKmh;
            return this;
        }

        public Builder lengthMeters(int lengthMeters) {
            this.lengthMeters = lengthMeters;
            return this;
        }

        public Builder currentSection(Section section) {
            this.currentSection = section;
            return this;
        }

        public Builder currentStation(Station station) {
            this.currentStation = station;
            return this;
        }

        public Builder status(TrainStatus status) {
            this.status = status;
            return this;
        }

        public Builder delayMinutes(int delayMinutes) {
            this.delayMinutes = delayMinutes;
            return this;
        }

        public Builder scheduledDeparture(Instant scheduledDeparture) {
            this.scheduledDeparture = scheduledDeparture;
            return this;
        }

        public Builder actualDeparture(Instant actualDeparture) {
            this.actualDeparture = actualDeparture;
            return this;
        }

        public Builder scheduledArrival(Instant scheduledArrival) {
            this.scheduledArrival = scheduledArrival;
            return this;
        }

        public Builder actualArrival(Instant actualArrival) {
            this.actualArrival = actualArrival;
            return this;
        }

        public Train build() {
            return new Train(this);
        }
    }
}
