package com.sandy.aiot.vision.pipeline.service.ingest;

/**
 * Why a submitted reading did not enter the pipeline. The validator produces the first
 * four; the last two come from the ingestion buffer and the runtime.
 */
public enum RejectReason {
    NON_FINITE_VALUE,
    EMPTY_IDENTIFIER,
    TIMESTAMP_REGRESSION,
    UNKNOWN_SENSOR,
    BUFFER_FULL,
    SHUTTING_DOWN
}
