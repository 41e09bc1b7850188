package com.sandy.aiot.vision.pipeline.model;

import java.time.Instant;

/** Read-only description of a closed window, published instead of its readings. */
public record WindowSummary(String sensorId, String equipmentId, long sequence, Instant start, Instant end,
                            int readingCount, boolean partial) {
}
