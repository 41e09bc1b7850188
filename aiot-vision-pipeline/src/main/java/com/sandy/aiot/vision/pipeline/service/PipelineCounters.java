package com.sandy.aiot.vision.pipeline.service;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-reason counters of everything the pipeline accepts, drops or degrades.
 * Nothing leaves the pipeline without being counted here or in the validator.
 */
@Component
public class PipelineCounters {

    public enum Counter {
        READINGS_ACCEPTED,
        READINGS_PROCESSED,
        READINGS_REJECTED_BUFFER_FULL,
        READINGS_REJECTED_SHUTTING_DOWN,
        READINGS_DROPPED_OLDEST,
        READINGS_EXCLUDED_BAD_QUALITY,
        READINGS_DISCARDED_SHUTDOWN,
        WINDOWS_CLOSED,
        WINDOWS_PARTIAL,
        WINDOWS_DROPPED_INSUFFICIENT_DATA,
        WINDOWS_DROPPED_STALE,
        FEATURE_VECTORS,
        PREDICTIONS,
        PREDICTIONS_DEGRADED,
        PREDICTIONS_SKIPPED_WARMUP,
        PREDICTIONS_SKIPPED_NO_BASELINE,
        PREDICTIONS_SKIPPED_NO_BINDING,
        INVARIANT_VIOLATIONS,
        PROCESSING_ERRORS,
        ALERTS_TRIGGERED,
        DISPATCH_CONGESTED,
        EVENTS_PUBLISHED
    }

    private final Map<Counter, LongAdder> counters = new EnumMap<>(Counter.class);

    public PipelineCounters() {
        for (Counter c : Counter.values()) {
            counters.put(c, new LongAdder());
        }
    }

    public void increment(Counter counter) {
        counters.get(counter).increment();
    }

    public void add(Counter counter, long delta) {
        counters.get(counter).add(delta);
    }

    public long get(Counter counter) {
        return counters.get(counter).sum();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> map = new LinkedHashMap<>();
        counters.forEach((k, v) -> map.put(k.name(), v.sum()));
        return map;
    }
}
