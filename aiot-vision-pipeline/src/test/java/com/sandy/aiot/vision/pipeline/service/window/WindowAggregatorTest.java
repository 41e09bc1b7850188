package com.sandy.aiot.vision.pipeline.service.window;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.model.Quality;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.model.Window;
import com.sandy.aiot.vision.pipeline.model.WindowMode;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.support.Fixtures;
import com.sandy.aiot.vision.pipeline.support.MutableClock;
import com.sandy.aiot.vision.pipeline.support.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.sandy.aiot.vision.pipeline.support.Fixtures.T0;
import static com.sandy.aiot.vision.pipeline.support.Fixtures.reading;
import static org.junit.jupiter.api.Assertions.*;

class WindowAggregatorTest {

    private PipelineProperties properties;
    private MutableClock clock;
    private PipelineCounters counters;
    private RecordingPublisher publisher;

    @BeforeEach
    void setUp() {
        properties = Fixtures.properties();
        properties.getWindow().setMode(WindowMode.COUNT);
        properties.getWindow().setSize(4);
        properties.getWindow().setStride(4);
        properties.getWindow().setMinReadings(2);
        properties.getWindow().setStalenessTimeout(Duration.ofMinutes(1));
        SensorDefinition load = properties.getSensors().get(1);
        load.setWindowMode(WindowMode.DURATION);
        load.setWindowDuration(Duration.ofSeconds(10));
        load.setWindowStrideDuration(Duration.ofSeconds(10));
        load.setMinReadings(1);
        clock = new MutableClock(T0);
        counters = new PipelineCounters();
        publisher = new RecordingPublisher();
    }

    private WindowAggregator aggregator() {
        return new WindowAggregator(Fixtures.registry(properties), properties, counters, publisher, clock);
    }

    private static List<Double> values(Window w) {
        return w.getReadings().stream().map(Reading::getValue).collect(Collectors.toList());
    }

    @Test
    void countWindowClosesAtSizeWithReadingBounds() {
        WindowAggregator aggregator = aggregator();
        for (int i = 0; i < 3; i++) {
            assertTrue(aggregator.append(reading("temp", T0.plusSeconds(i), i)).isEmpty());
        }
        List<Window> closed = aggregator.append(reading("temp", T0.plusSeconds(3), 3));
        assertEquals(1, closed.size());
        Window w = closed.get(0);
        assertEquals(List.of(0.0, 1.0, 2.0, 3.0), values(w));
        assertEquals(T0, w.getStart());
        assertEquals(T0.plusSeconds(3).plusNanos(1), w.getEnd());
        assertTrue(w.getReadings().stream().allMatch(r -> !r.getTimestamp().isBefore(w.getStart())
                && r.getTimestamp().isBefore(w.getEnd())));
        assertFalse(w.isPartial());
        assertEquals(1, w.getSequence());
        assertEquals(0, aggregator.openWindowCount());
    }

    @Test
    void overlappingCountWindowsShareReadings() {
        properties.getWindow().setStride(2);
        WindowAggregator aggregator = aggregator();
        List<Window> all = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            all.addAll(aggregator.append(reading("temp", T0.plusSeconds(i), i)));
        }
        assertEquals(3, all.size());
        assertEquals(List.of(0.0, 1.0, 2.0, 3.0), values(all.get(0)));
        assertEquals(List.of(2.0, 3.0, 4.0, 5.0), values(all.get(1)));
        assertEquals(List.of(4.0, 5.0, 6.0, 7.0), values(all.get(2)));
    }

    @Test
    void durationWindowClosesOnFirstReadingPastItsEnd() {
        WindowAggregator aggregator = aggregator();
        aggregator.append(reading("load", T0, 1));
        aggregator.append(reading("load", T0.plusSeconds(5), 2));
        assertTrue(aggregator.append(reading("load", T0.plusMillis(9_999), 3)).isEmpty());

        List<Window> closed = aggregator.append(reading("load", T0.plusSeconds(10), 4));
        assertEquals(1, closed.size());
        assertEquals(List.of(1.0, 2.0, 3.0), values(closed.get(0)));
        assertEquals(T0, closed.get(0).getStart());
        assertEquals(T0.plusSeconds(10), closed.get(0).getEnd());
    }

    @Test
    void durationWindowSkipsEmptyIntervalsAfterAGap() {
        WindowAggregator aggregator = aggregator();
        aggregator.append(reading("load", T0, 1));
        aggregator.append(reading("load", T0.plusSeconds(10), 2));

        List<Window> closed = aggregator.append(reading("load", T0.plusSeconds(35), 3));
        assertEquals(1, closed.size());
        assertEquals(T0.plusSeconds(10), closed.get(0).getStart());
        assertEquals(List.of(2.0), values(closed.get(0)));

        closed = aggregator.append(reading("load", T0.plusSeconds(40), 4));
        assertEquals(T0.plusSeconds(30), closed.get(0).getStart());
        assertEquals(List.of(3.0), values(closed.get(0)));
    }

    @Test
    void badQualityReadingsAreExcluded() {
        WindowAggregator aggregator = aggregator();
        Reading bad = reading("temp", T0, 99).toBuilder().quality(Quality.BAD).build();
        assertTrue(aggregator.append(bad).isEmpty());
        assertEquals(0, aggregator.openWindowCount());
        assertEquals(1, counters.get(PipelineCounters.Counter.READINGS_EXCLUDED_BAD_QUALITY));
    }

    @Test
    void staleWindowIsEmittedPartialWhenItMeetsTheMinimum() {
        WindowAggregator aggregator = aggregator();
        aggregator.append(reading("temp", T0, 1));
        aggregator.append(reading("temp", T0.plusSeconds(1), 2));

        clock.advance(Duration.ofSeconds(30));
        assertTrue(aggregator.reap(s -> true).isEmpty());

        clock.advance(Duration.ofSeconds(31));
        List<Window> reaped = aggregator.reap(s -> true);
        assertEquals(1, reaped.size());
        assertTrue(reaped.get(0).isPartial());
        assertEquals(2, reaped.get(0).size());
        assertEquals(T0, reaped.get(0).getStart());
        assertTrue(T0.plusSeconds(1).isBefore(reaped.get(0).getEnd()));
        assertEquals(1, counters.get(PipelineCounters.Counter.WINDOWS_PARTIAL));
    }

    @Test
    void staleWindowBelowMinimumIsDroppedWithDiagnostic() {
        WindowAggregator aggregator = aggregator();
        aggregator.append(reading("temp", T0, 1));
        clock.advance(Duration.ofMinutes(2));

        assertTrue(aggregator.reap(s -> true).isEmpty());
        assertEquals(1, counters.get(PipelineCounters.Counter.WINDOWS_DROPPED_STALE));
        assertEquals(1, publisher.diagnostics(DiagnosticType.WINDOW_DROPPED).size());
        assertEquals(0, aggregator.openWindowCount());
    }

    @Test
    void flushHonoursTheMinimumCountBoundary() {
        WindowAggregator aggregator = aggregator();
        aggregator.append(reading("temp", T0, 1));
        aggregator.append(reading("temp", T0.plusSeconds(1), 2));
        aggregator.append(reading("load", T0, 5));

        List<Window> flushed = aggregator.flush(s -> s.equals("temp"));
        assertEquals(1, flushed.size());
        assertTrue(flushed.get(0).isPartial());
        assertEquals(1, aggregator.openWindowCount());

        properties.getSensors().get(1).setMinReadings(2);
        WindowAggregator strict = aggregator();
        strict.append(reading("load", T0, 5));
        assertTrue(strict.flush(s -> true).isEmpty());
        assertEquals(1, counters.get(PipelineCounters.Counter.WINDOWS_DROPPED_INSUFFICIENT_DATA));
    }
}
