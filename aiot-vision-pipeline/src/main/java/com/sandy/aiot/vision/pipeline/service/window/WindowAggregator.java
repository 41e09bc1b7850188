package com.sandy.aiot.vision.pipeline.service.window;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.model.Quality;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.model.Window;
import com.sandy.aiot.vision.pipeline.model.WindowMode;
import com.sandy.aiot.vision.pipeline.model.WindowSpec;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.dispatch.PipelineEventPublisher;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Keeps one open window per sensor and closes it by count or by event time.
 * <p>
 * A sensor's state is only touched by the worker owning its partition. Staleness is measured
 * in processing time since the last appended reading, so a sensor that stops reporting still
 * gets its window closed.
 */
@Component
@Slf4j
public class WindowAggregator {

    private final SensorRegistry sensorRegistry;
    private final PipelineCounters counters;
    private final PipelineEventPublisher publisher;
    private final Clock clock;
    private final Duration stalenessTimeout;

    private final Map<String, SensorWindow> windows = new ConcurrentHashMap<>();

    public WindowAggregator(SensorRegistry sensorRegistry, PipelineProperties properties, PipelineCounters counters,
                            PipelineEventPublisher publisher, Clock clock) {
        this.sensorRegistry = sensorRegistry;
        this.counters = counters;
        this.publisher = publisher;
        this.clock = clock;
        this.stalenessTimeout = properties.getWindow().getStalenessTimeout();
    }

    /**
     * Appends a reading to its sensor's open window.
     *
     * @return windows closed by this reading, oldest first; usually empty
     */
    public List<Window> append(Reading reading) {
        if (reading.getQuality() == Quality.BAD) {
            counters.increment(PipelineCounters.Counter.READINGS_EXCLUDED_BAD_QUALITY);
            return List.of();
        }
        SensorWindow state = windows.computeIfAbsent(reading.getSensorId(), this::newState);
        List<Window> closed = new ArrayList<>(1);
        refreshSpec(state, closed);
        if (state.spec.getMode() == WindowMode.COUNT) {
            appendByCount(state, reading, closed);
        } else {
            appendByDuration(state, reading, closed);
        }
        state.lastAppend = clock.instant();
        return closed;
    }

    /**
     * Force-closes windows of the selected sensors that saw no reading for the staleness timeout.
     * Windows meeting the minimum count are returned as partial, the others are discarded and counted.
     */
    public List<Window> reap(Predicate<String> sensorFilter) {
        Instant cutoff = clock.instant().minus(stalenessTimeout);
        List<Window> out = new ArrayList<>();
        for (SensorWindow state : windows.values()) {
            if (!sensorFilter.test(state.sensorId) || state.readings.isEmpty()) continue;
            if (state.lastAppend != null && state.lastAppend.isAfter(cutoff)) continue;
            forceClose(state, out, PipelineCounters.Counter.WINDOWS_DROPPED_STALE, "stale");
        }
        return out;
    }

    /** Force-closes every open window of the selected sensors, used on shutdown. */
    public List<Window> flush(Predicate<String> sensorFilter) {
        List<Window> out = new ArrayList<>();
        for (SensorWindow state : windows.values()) {
            if (!sensorFilter.test(state.sensorId) || state.readings.isEmpty()) continue;
            forceClose(state, out, PipelineCounters.Counter.WINDOWS_DROPPED_INSUFFICIENT_DATA, "shutdown");
        }
        return out;
    }

    /** Minimum readings a closed window of the sensor needs to produce features. */
    public int minReadingsOf(String sensorId) {
        SensorWindow state = windows.get(sensorId);
        if (state != null) return state.spec.getMinReadings();
        return sensorRegistry.findSensor(sensorId).map(s -> sensorRegistry.windowSpecOf(s).getMinReadings()).orElse(1);
    }

    public Optional<WindowSpec> specOf(String sensorId) {
        SensorWindow state = windows.get(sensorId);
        return state == null ? Optional.empty() : Optional.of(state.spec);
    }

    public int openWindowCount() {
        return (int) windows.values().stream().filter(w -> !w.readings.isEmpty()).count();
    }

    private void appendByCount(SensorWindow state, Reading reading, List<Window> closed) {
        state.readings.add(reading);
        WindowSpec spec = state.spec;
        if (state.readings.size() < spec.getSize()) return;
        List<Reading> content = new ArrayList<>(state.readings.subList(0, spec.getSize()));
        closed.add(emit(state, content.get(0).getTimestamp(), countEnd(content), content, false));
        state.readings.subList(0, spec.getStride()).clear();
    }

    private void appendByDuration(SensorWindow state, Reading reading, List<Window> closed) {
        WindowSpec spec = state.spec;
        Instant ts = reading.getTimestamp();
        if (state.start == null) {
            state.start = ts;
        }
        while (!ts.isBefore(state.start.plus(spec.getDuration()))) {
            Instant end = state.start.plus(spec.getDuration());
            if (!state.readings.isEmpty()) {
                closed.add(emit(state, state.start, end, new ArrayList<>(state.readings), false));
            }
            Instant nextStart = state.start.plus(spec.getStrideDuration());
            state.readings.removeIf(r -> r.getTimestamp().isBefore(nextStart));
            state.start = nextStart;
            if (state.readings.isEmpty() && !ts.isBefore(nextStart.plus(spec.getDuration()))) {
                state.start = skipTo(nextStart, ts, spec);
            }
        }
        state.readings.add(reading);
    }

    /** Exclusive end of a count window: one nanosecond past its last reading. */
    private static Instant countEnd(List<Reading> content) {
        return content.get(content.size() - 1).getTimestamp().plusNanos(1);
    }

    /** First stride-aligned start after {@code from} whose window contains {@code ts}. */
    private static Instant skipTo(Instant from, Instant ts, WindowSpec spec) {
        long strideNanos = spec.getStrideDuration().toNanos();
        long gapNanos = Duration.between(from, ts.minus(spec.getDuration())).toNanos();
        long steps = Math.floorDiv(gapNanos, strideNanos) + 1;
        return from.plusNanos(steps * strideNanos);
    }

    private void forceClose(SensorWindow state, List<Window> out, PipelineCounters.Counter dropCounter, String cause) {
        List<Reading> content = new ArrayList<>(state.readings);
        WindowSpec spec = state.spec;
        Instant start = spec.getMode() == WindowMode.COUNT ? content.get(0).getTimestamp() : state.start;
        Instant end = spec.getMode() == WindowMode.COUNT ? countEnd(content) : state.start.plus(spec.getDuration());
        state.readings.clear();
        state.start = null;
        if (content.size() >= spec.getMinReadings()) {
            out.add(emit(state, start, end, content, true));
            return;
        }
        counters.increment(dropCounter);
        log.info("Window discarded sensorId={} cause={} readings={} minReadings={}", state.sensorId, cause,
                content.size(), spec.getMinReadings());
        publisher.diagnostic(DiagnosticEvent.builder()
                .type(DiagnosticType.WINDOW_DROPPED)
                .sensorId(state.sensorId)
                .equipmentId(state.equipmentId)
                .message(cause + " window below minimum reading count")
                .detail("readings", content.size())
                .detail("minReadings", spec.getMinReadings())
                .at(clock.instant())
                .build());
    }

    private Window emit(SensorWindow state, Instant start, Instant end, List<Reading> content, boolean partial) {
        counters.increment(PipelineCounters.Counter.WINDOWS_CLOSED);
        if (partial) counters.increment(PipelineCounters.Counter.WINDOWS_PARTIAL);
        return new Window(state.sensorId, content.get(0).getEquipmentId(), ++state.sequence, start, end, content,
                partial);
    }

    /** A redefined sensor closes its current window as partial and continues with the new spec. */
    private void refreshSpec(SensorWindow state, List<Window> closed) {
        Optional<SensorDefinition> current = sensorRegistry.findSensor(state.sensorId);
        if (current.isEmpty() || current.get() == state.definition) return;
        WindowSpec spec = sensorRegistry.windowSpecOf(current.get());
        state.definition = current.get();
        state.equipmentId = current.get().getEquipmentId();
        if (spec.equals(state.spec)) return;
        log.info("Window spec changed sensorId={} from={} to={}", state.sensorId, state.spec, spec);
        if (!state.readings.isEmpty()) {
            forceClose(state, closed, PipelineCounters.Counter.WINDOWS_DROPPED_INSUFFICIENT_DATA, "reconfigured");
        }
        state.spec = spec;
    }

    private SensorWindow newState(String sensorId) {
        SensorDefinition definition = sensorRegistry.findSensor(sensorId)
                .orElseThrow(() -> new IllegalStateException("Sensor[sensorId=" + sensorId + "] not registered"));
        return new SensorWindow(sensorId, definition.getEquipmentId(), definition,
                sensorRegistry.windowSpecOf(definition));
    }

    private static final class SensorWindow {
        private final String sensorId;
        private volatile String equipmentId;
        private volatile SensorDefinition definition;
        private volatile WindowSpec spec;
        private final List<Reading> readings = new ArrayList<>();
        private Instant start;
        private long sequence;
        private volatile Instant lastAppend;

        SensorWindow(String sensorId, String equipmentId, SensorDefinition definition, WindowSpec spec) {
            this.sensorId = sensorId;
            this.equipmentId = equipmentId;
            this.definition = definition;
            this.spec = spec;
        }
    }
}
