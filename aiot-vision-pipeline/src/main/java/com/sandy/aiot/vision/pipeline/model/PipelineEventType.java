package com.sandy.aiot.vision.pipeline.model;

public enum PipelineEventType {
    READING_ACCEPTED,
    WINDOW_CLOSED,
    PREDICTION_PRODUCED,
    ALERT_TRIGGERED,
    ALERT_ACKNOWLEDGED,
    ALERT_RESOLVED,
    ALERT_SUPPRESSION_CHANGED,
    DIAGNOSTIC
}
