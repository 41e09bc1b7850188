package com.sandy.aiot.vision.pipeline.service.dispatch;

import com.sandy.aiot.vision.pipeline.model.PipelineEvent;

import java.time.Instant;

/** Event as queued for one subscriber. Sequence numbers grow by one per channel. */
public record Envelope(long seq, PipelineEvent event, Instant enqueuedAt) {
}
