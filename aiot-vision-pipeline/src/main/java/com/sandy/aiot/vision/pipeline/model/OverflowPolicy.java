package com.sandy.aiot.vision.pipeline.model;

/**
 * What an ingestion lane does with a new reading when it is already at capacity.
 */
public enum OverflowPolicy {
    /** Keep the buffered history and refuse the incoming reading. */
    REJECT_NEWEST,
    /** Evict the oldest buffered reading to make room. */
    DROP_OLDEST
}
