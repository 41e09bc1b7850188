package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.model.FeatureVector;

/**
 * Scores feature vectors of any number of sensors. Per-sensor history is kept by the scorer;
 * calls for one sensor never overlap, calls for different sensors may.
 */
public interface AnomalyScorer {

    String modelId();

    ScorerType type();

    ScoreDomain domain();

    /**
     * @throws RuntimeException when the underlying model fails; the caller degrades the result
     */
    ScoreOutcome score(FeatureVector vector);

    /** Drops the history kept for a sensor. */
    default void forget(String sensorId) {
    }
}
