package com.sandy.aiot.vision.pipeline.service.runtime;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.EventFilter;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;
import com.sandy.aiot.vision.pipeline.model.PipelineEventType;
import com.sandy.aiot.vision.pipeline.model.RawReading;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.WindowSummary;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters.Counter;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.service.alert.RuleBook;
import com.sandy.aiot.vision.pipeline.service.dispatch.Envelope;
import com.sandy.aiot.vision.pipeline.service.dispatch.ResultDispatcher;
import com.sandy.aiot.vision.pipeline.service.dispatch.Subscription;
import com.sandy.aiot.vision.pipeline.service.feature.FeatureExtractor;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionBuffer;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionService;
import com.sandy.aiot.vision.pipeline.service.ingest.ReadingValidator;
import com.sandy.aiot.vision.pipeline.service.ingest.RejectReason;
import com.sandy.aiot.vision.pipeline.service.ingest.SubmitResult;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import com.sandy.aiot.vision.pipeline.service.scoring.ConfidenceDriftMonitor;
import com.sandy.aiot.vision.pipeline.service.scoring.ModelRegistry;
import com.sandy.aiot.vision.pipeline.service.scoring.ScoringService;
import com.sandy.aiot.vision.pipeline.service.window.WindowAggregator;
import com.sandy.aiot.vision.pipeline.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static com.sandy.aiot.vision.pipeline.support.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class PipelineRuntimeTest {

    private final Clock clock = Clock.systemUTC();
    private PipelineProperties properties;
    private PipelineCounters counters;
    private SensorRegistry registry;
    private ResultDispatcher dispatcher;
    private IngestionBuffer buffer;
    private IngestionService ingestionService;
    private PipelineRuntime runtime;

    /** Holds the worker inside the first reading it gets until released. */
    static class BlockingProcessor extends PipelineProcessor {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        BlockingProcessor() {
            super(null, null, null, null, null, null, null, new PipelineProperties());
        }

        @Override
        public void process(Reading reading) {
            entered.countDown();
            boolean interrupted = false;
            while (true) {
                try {
                    release.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) Thread.currentThread().interrupt();
        }

        @Override
        public void reap(Predicate<String> sensorFilter) {
        }

        @Override
        public void flush(Predicate<String> sensorFilter) {
        }
    }

    @BeforeEach
    void setUp() {
        properties = Fixtures.properties();
        properties.getWindow().setSize(4);
        properties.getWindow().setStride(4);
        properties.getWindow().setMinReadings(2);
        properties.getScoring().getStatistical().setMinBaseline(2);
        counters = new PipelineCounters();
        registry = Fixtures.registry(properties);
        dispatcher = new ResultDispatcher(properties, counters, clock);
        dispatcher.start();
        buffer = new IngestionBuffer(registry, properties, counters, dispatcher, clock);
        ingestionService = new IngestionService(new ReadingValidator(registry, clock), buffer, counters);
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    private PipelineProcessor processor() {
        RuleBook ruleBook = new RuleBook(properties, registry);
        ruleBook.init();
        ModelRegistry modelRegistry = new ModelRegistry(properties);
        modelRegistry.init();
        ScoringService scoring = new ScoringService(modelRegistry, registry,
                new ConfidenceDriftMonitor(properties, dispatcher), counters, dispatcher, clock);
        AlertRuleEngine engine = new AlertRuleEngine(ruleBook, registry, properties, dispatcher, counters, clock);
        return new PipelineProcessor(new WindowAggregator(registry, properties, counters, dispatcher, clock),
                new FeatureExtractor(properties), scoring, engine, dispatcher, counters, clock, properties);
    }

    private void start(PipelineProcessor processor) {
        runtime = new PipelineRuntime(properties, ingestionService, buffer, processor, dispatcher, counters, clock);
        runtime.start();
    }

    private static RawReading raw(int i, double value) {
        return RawReading.builder().sensorId("temp").timestamp(T0.plusSeconds(i)).value(value).quality("GOOD").build();
    }

    @Test
    void shutdownDrainsReadingsAndFlushesOpenWindowsAsPartial() {
        start(processor());
        Subscription windows = dispatcher.subscribe("windows",
                EventFilter.ofTypes(PipelineEventType.WINDOW_CLOSED, PipelineEventType.PREDICTION_PRODUCED));
        for (int i = 0; i < 14; i++) {
            assertTrue(ingestionService.submit(raw(i, 10 + i % 3)).isAccepted());
        }

        runtime.shutdown(Duration.ofSeconds(10));

        assertFalse(runtime.isRunning());
        assertEquals(14, counters.get(Counter.READINGS_PROCESSED));
        assertEquals(4, counters.get(Counter.WINDOWS_CLOSED));
        assertEquals(1, counters.get(Counter.WINDOWS_PARTIAL));
        assertEquals(2, counters.get(Counter.PREDICTIONS));
        assertEquals(0, counters.get(Counter.READINGS_DISCARDED_SHUTDOWN));

        List<PipelineEvent> events = windows.poll(100).events().stream().map(Envelope::event)
                .collect(Collectors.toList());
        List<WindowSummary> closed = events.stream()
                .filter(e -> e.getType() == PipelineEventType.WINDOW_CLOSED)
                .map(e -> e.payloadAs(WindowSummary.class))
                .collect(Collectors.toList());
        assertEquals(4, closed.size());
        assertTrue(closed.get(3).partial());
        assertEquals(2, closed.get(3).readingCount());
        assertEquals(2, events.stream().filter(e -> e.getType() == PipelineEventType.PREDICTION_PRODUCED).count());

        SubmitResult late = ingestionService.submit(raw(20, 10));
        assertFalse(late.isAccepted());
        assertEquals(RejectReason.SHUTTING_DOWN, late.getReason());
    }

    @Test
    void stuckWorkerTimesOutAndCountsDiscardedReadings() throws Exception {
        BlockingProcessor blocking = new BlockingProcessor();
        start(blocking);
        try {
            assertTrue(ingestionService.submit(raw(0, 1)).isAccepted());
            assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
            for (int i = 1; i <= 5; i++) {
                assertTrue(ingestionService.submit(raw(i, 1)).isAccepted());
            }

            PipelineShutdownException e = assertThrows(PipelineShutdownException.class,
                    () -> runtime.shutdown(Duration.ofMillis(300)));
            assertTrue(e.getMessage().contains("discarded=5"));
            assertEquals(5, counters.get(Counter.READINGS_DISCARDED_SHUTDOWN));
            assertEquals(0, buffer.totalDepth());
            assertFalse(ingestionService.isAccepting());
        } finally {
            blocking.release.countDown();
        }
    }
}
