package com.sandy.aiot.vision.pipeline.model;

public enum DiagnosticType {
    /** An ingestion lane crossed its high-water mark. */
    CONGESTED,
    CONGESTION_CLEARED,
    /** The dispatcher outbox stayed full past the send timeout. */
    DISPATCH_CONGESTED,
    /** Readings evicted or discarded (drop-oldest overflow, shutdown). */
    READINGS_DROPPED,
    /** A window was discarded: below minimum count or unusable. */
    WINDOW_DROPPED,
    SCORER_UNAVAILABLE,
    SCORER_RECOVERED,
    MODEL_DRIFT_SUSPECTED,
    MODEL_DRIFT_CLEARED,
    /** A unit of work broke an invariant and was dropped. */
    INVARIANT_VIOLATION,
    /** A subscriber channel lost events (overflow or retention expiry). */
    SUBSCRIBER_LAGGING
}
