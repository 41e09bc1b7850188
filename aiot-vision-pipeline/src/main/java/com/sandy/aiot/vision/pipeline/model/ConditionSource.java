package com.sandy.aiot.vision.pipeline.model;

/**
 * Which observed quantity a rule condition is evaluated against.
 * {@link #VALUE} is evaluated on readings, every other source on prediction results.
 */
public enum ConditionSource {
    VALUE,
    SCORE,
    CONFIDENCE,
    /** 1.0 when the prediction is flagged anomalous, 0.0 otherwise. */
    ANOMALY,
    /** A named feature of the prediction's input snapshot. */
    FEATURE;

    public boolean appliesToReadings() {
        return this == VALUE;
    }
}
