package com.sandy.aiot.vision.pipeline.service.dispatch;

import java.util.List;

/**
 * @param events unacknowledged events, oldest first
 * @param lost   events dropped or expired since the previous poll
 */
public record PollResult(List<Envelope> events, long lost) {
}
