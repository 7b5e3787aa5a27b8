package com.questrail.dispatch;

import com.questrail.dispatch.model.Section;
import com.questrail.dispatch.model.Station;
import com.questrail.dispatch.model.SystemState;
import com.questrail.dispatch.model.Train;
import com.questrail.dispatch.model.TrainStatus;
import com.questrail.dispatch.model.TrainType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Small building blocks for network snapshots used across tests.
 */
public final class NetworkFixtures {

    public static final Instant SNAPSHOT_TIME = Instant.parse("2024-03-01T08:00:00Z");

    private NetworkFixtures() {}

    public static Station station(int i) {
        return Station.of("Station " + i, "ST" + i, 19.0176 + i * 0.01, 72.8562 + i * 0.01, 4);
    }

    public static Section singleTrack(Station from, Station to) {
        return Section.between(from, to, 10.0, 80, 1);
    }

    public static Section singleTrack() {
        return singleTrack(station(1), station(2));
    }

    public static Train running(String number, TrainType type, Section section, int delayMinutes) {
        return Train.builder()
                .number(number)
                .name(number + " " + type.code())
                .type(type)
                .maxSpeedKmh(80)
                .lengthMeters(400)
                .currentSection(section)
                .status(delayMinutes > 0 ? TrainStatus.DELAYED : TrainStatus.RUNNING)
                .delayMinutes(delayMinutes)
                .build();
    }

    public static SystemState snapshot(List<Train> trains, List<Section> sections) {
        List<Station> stations = new ArrayList<>();
        for (Section section : sections) {
            if (!stations.contains(section.fromStation())) {
                stations.add(section.fromStation());
            }
            if (!stations.contains(section.toStation())) {
                stations.add(section.toStation());
            }
        }
        return SystemState.of(SNAPSHOT_TIME, trains, sections, stations);
    }

    /**
     * Ten stations in a line, nine single-track sections, five express trains
     * spread over the first five sections with delays 0, 5, 10, 15, 20.
     */
    public static SystemState corridor() {
        List<Station> stations = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            stations.add(station(i));
        }
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            sections.add(singleTrack(stations.get(i), stations.get(i + 1)));
        }
        List<Train> trains = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            trains.add(running(String.format("T%05d", i), TrainType.EXPRESS, sections.get(i % sections.size()), i * 5));
        }
        return SystemState.of(SNAPSHOT_TIME, trains, sections, stations);
    }
}
