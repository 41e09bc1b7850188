package com.sandy.aiot.vision.pipeline.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A closed window handed from the aggregator to the feature extractor.
 * Bounds are closed-open {@code [start, end)} and contain every reading. Count windows start at
 * their first reading and end one nanosecond after their last.
 */
@Value
public class Window {
    String sensorId;
    String equipmentId;
    long sequence;
    Instant start;
    Instant end;
    List<Reading> readings;
    /** Force-closed by the reaper or by shutdown before reaching its natural end. */
    boolean partial;

    public Window(String sensorId, String equipmentId, long sequence, Instant start, Instant end,
                  List<Reading> readings, boolean partial) {
        this.sensorId = sensorId;
        this.equipmentId = equipmentId;
        this.sequence = sequence;
        this.start = start;
        this.end = end;
        this.readings = List.copyOf(readings);
        this.partial = partial;
    }

    public int size() {
        return readings.size();
    }

    public WindowSummary summary() {
        return new WindowSummary(sensorId, equipmentId, sequence, start, end, readings.size(), partial);
    }
}
