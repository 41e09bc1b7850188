package com.sandy.aiot.vision.pipeline.service.ingest;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one submitted reading, returned synchronously to the producer.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmitResult {
    boolean accepted;
    RejectReason reason;
    String detail;
    /** The sensor's lane is above its high-water mark; producers should slow down. */
    boolean congested;

    public static SubmitResult accepted(boolean congested) {
        return new SubmitResult(true, null, null, congested);
    }

    public static SubmitResult rejected(RejectReason reason, String detail, boolean congested) {
        return new SubmitResult(false, reason, detail, congested);
    }
}
