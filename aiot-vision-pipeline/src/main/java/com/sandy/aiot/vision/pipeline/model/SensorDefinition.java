package com.sandy.aiot.vision.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Registered sensor. Limits are optional; window and buffer fields override the pipeline defaults when set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SensorDefinition {
    private String id;
    private String equipmentId;
    private String name;
    private String unit;
    private Double min;
    private Double max;
    /** Values above this raise a derived MEDIUM alert. */
    private Double warning;
    /** Values above this raise a derived HIGH alert. */
    private Double critical;

    private Integer bufferCapacity;
    private WindowMode windowMode;
    private Integer windowSize;
    private Integer windowStride;
    private Duration windowDuration;
    private Duration windowStrideDuration;
    private Integer minReadings;
}
