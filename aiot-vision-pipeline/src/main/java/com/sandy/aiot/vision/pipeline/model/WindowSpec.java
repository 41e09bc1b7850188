package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Resolved window configuration of one sensor.
 * Count windows use {@code size}/{@code stride}, duration windows use
 * {@code duration}/{@code strideDuration}.
 */
@Value
public class WindowSpec {
    WindowMode mode;
    int size;
    int stride;
    Duration duration;
    Duration strideDuration;
    int minReadings;

    @Builder
    public WindowSpec(WindowMode mode, int size, int stride, Duration duration, Duration strideDuration,
                      int minReadings) {
        if (mode == null) throw new IllegalArgumentException("window mode is required");
        if (mode == WindowMode.COUNT) {
            if (size <= 0) throw new IllegalArgumentException("window size must be positive: " + size);
            if (stride <= 0 || stride > size) {
                throw new IllegalArgumentException("window stride must be in (0, size]: stride=" + stride + " size=" + size);
            }
        } else {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException("window duration must be positive: " + duration);
            }
            if (strideDuration == null || strideDuration.isZero() || strideDuration.isNegative()
                    || strideDuration.compareTo(duration) > 0) {
                throw new IllegalArgumentException("window stride must be in (0, duration]: stride="
                        + strideDuration + " duration=" + duration);
            }
        }
        if (minReadings < 1) throw new IllegalArgumentException("minReadings must be at least 1: " + minReadings);
        if (mode == WindowMode.COUNT && minReadings > size) {
            throw new IllegalArgumentException("minReadings " + minReadings + " exceeds window size " + size);
        }
        this.mode = mode;
        this.size = size;
        this.stride = stride;
        this.duration = duration;
        this.strideDuration = strideDuration;
        this.minReadings = minReadings;
    }

    public boolean isOverlapping() {
        return mode == WindowMode.COUNT ? stride < size : strideDuration.compareTo(duration) < 0;
    }
}
