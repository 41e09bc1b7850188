package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Fixed set of named features computed from one window. Feature order is stable.
 */
@Value
@Builder
public class FeatureVector {
    public static final String MEAN = "mean";
    public static final String VARIANCE = "variance";
    public static final String STD = "std";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String RANGE = "range";
    public static final String RMS = "rms";
    public static final String SKEWNESS = "skewness";
    public static final String KURTOSIS = "kurtosis";
    public static final String DOMINANT_FREQUENCY = "dominant_frequency";
    public static final String SPECTRAL_CENTROID = "spectral_centroid";

    String sensorId;
    String equipmentId;
    Instant windowStart;
    Instant windowEndTime;
    Map<String, Double> features;
    int sourceReadingCount;
    boolean partial;

    public Double feature(String name) {
        return features.get(name);
    }

    public static String percentileName(double percentile) {
        if (percentile == Math.rint(percentile)) {
            return "p" + (long) percentile;
        }
        return "p" + String.valueOf(percentile).replace('.', '_');
    }
}
