package com.sandy.aiot.vision.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reading as handed over by a protocol adapter, before validation.
 * Every field may be missing or malformed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawReading {
    private String sensorId;
    private String equipmentId;
    private Instant timestamp;
    private Double value;
    private String quality;
    private String unit;
}
