package com.sandy.aiot.vision.pipeline.service.scoring;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.service.dispatch.PipelineEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling mean of prediction confidence per model. A mean below the floor for the configured
 * number of consecutive windows starts a drift episode; the first window back above the floor ends it.
 */
@Component
@Slf4j
public class ConfidenceDriftMonitor {

    private final PipelineEventPublisher publisher;
    private final int window;
    private final double floor;
    private final int consecutive;
    private final Map<String, ModelTrack> tracks = new ConcurrentHashMap<>();

    public ConfidenceDriftMonitor(PipelineProperties properties, PipelineEventPublisher publisher) {
        PipelineProperties.Drift drift = properties.getScoring().getDrift();
        this.publisher = publisher;
        this.window = Math.max(1, drift.getWindow());
        this.floor = drift.getConfidenceFloor();
        this.consecutive = Math.max(1, drift.getConsecutiveWindows());
    }

    public void observe(String modelId, double confidence, Instant at) {
        ModelTrack track = tracks.computeIfAbsent(modelId, k -> new ModelTrack(window));
        DiagnosticType transition = null;
        double mean;
        synchronized (track) {
            track.add(confidence);
            mean = track.mean();
            if (mean < floor) {
                track.below++;
                if (track.below >= consecutive && !track.drifting) {
                    track.drifting = true;
                    transition = DiagnosticType.MODEL_DRIFT_SUSPECTED;
                }
            } else {
                track.below = 0;
                if (track.drifting) {
                    track.drifting = false;
                    transition = DiagnosticType.MODEL_DRIFT_CLEARED;
                }
            }
        }
        if (transition != null) {
            log.warn("Model confidence drift transition={} modelId={} meanConfidence={} floor={}", transition, modelId,
                    mean, floor);
            publisher.diagnostic(DiagnosticEvent.builder()
                    .type(transition)
                    .modelId(modelId)
                    .message("rolling mean confidence " + mean + (transition == DiagnosticType.MODEL_DRIFT_SUSPECTED
                            ? " below " : " back at or above ") + floor)
                    .detail("meanConfidence", mean)
                    .detail("floor", floor)
                    .at(at)
                    .build());
        }
    }

    public boolean isDrifting(String modelId) {
        ModelTrack track = tracks.get(modelId);
        if (track == null) return false;
        synchronized (track) {
            return track.drifting;
        }
    }

    public Map<String, Double> meanConfidence() {
        Map<String, Double> map = new TreeMap<>();
        tracks.forEach((id, track) -> {
            synchronized (track) {
                map.put(id, track.mean());
            }
        });
        return map;
    }

    private static final class ModelTrack {
        private final double[] values;
        private int next;
        private int size;
        private double sum;
        private int below;
        private boolean drifting;

        ModelTrack(int window) {
            this.values = new double[window];
        }

        void add(double v) {
            if (size == values.length) {
                sum -= values[next];
            } else {
                size++;
            }
            values[next] = v;
            sum += v;
            next = (next + 1) % values.length;
        }

        double mean() {
            return size == 0 ? 1.0 : sum / size;
        }
    }
}
