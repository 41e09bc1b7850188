package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Validated sensor reading. The value is always finite and the identifiers non-blank.
 */
@Value
@Builder(toBuilder = true)
public class Reading {
    String sensorId;
    String equipmentId;
    Instant timestamp;
    double value;
    Quality quality;
    String unit;
}
