package com.sandy.aiot.vision.pipeline.service.ingest;

import lombok.Value;

import java.util.List;

@Value
public class BatchResult {
    List<SubmitResult> results;

    public BatchResult(List<SubmitResult> results) {
        this.results = List.copyOf(results);
    }

    public long getAccepted() {
        return results.stream().filter(SubmitResult::isAccepted).count();
    }

    public long getRejected() {
        return results.size() - getAccepted();
    }

    public boolean isCongested() {
        return results.stream().anyMatch(SubmitResult::isCongested);
    }

    public boolean isAnyBufferFull() {
        return results.stream().anyMatch(r -> r.getReason() == RejectReason.BUFFER_FULL);
    }
}
