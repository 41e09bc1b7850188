package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Output of the anomaly scorer for one feature vector.
 * A stale result carries the last known good score of the sensor while the bound model is unavailable.
 */
@Value
@Builder(toBuilder = true)
public class PredictionResult {
    String modelId;
    String equipmentId;
    String sensorId;
    double score;
    double confidence;
    boolean anomaly;
    boolean stale;
    Instant timestamp;
    Map<String, Double> inputFeatureSnapshot;
}
