package com.sandy.aiot.vision.pipeline.service.runtime;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.DiagnosticType;
import com.sandy.aiot.vision.pipeline.model.FeatureVector;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;
import com.sandy.aiot.vision.pipeline.model.PredictionResult;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.Window;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.service.dispatch.PipelineEventPublisher;
import com.sandy.aiot.vision.pipeline.service.feature.ExtractionResult;
import com.sandy.aiot.vision.pipeline.service.feature.FeatureExtractor;
import com.sandy.aiot.vision.pipeline.service.scoring.ScoringService;
import com.sandy.aiot.vision.pipeline.service.window.WindowAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Stage chain run by the partition workers: reading rules and windowing for every reading,
 * then extraction, scoring and prediction rules for every closed window.
 * <p>
 * A runtime exception drops only the unit it happened in (one reading or one window); it is
 * logged with its context, counted and published as an invariant-violation diagnostic.
 */
@Component
@Slf4j
public class PipelineProcessor {

    private final WindowAggregator aggregator;
    private final FeatureExtractor extractor;
    private final ScoringService scoringService;
    private final AlertRuleEngine alertRuleEngine;
    private final PipelineEventPublisher publisher;
    private final PipelineCounters counters;
    private final Clock clock;
    private final boolean publishReadings;

    public PipelineProcessor(WindowAggregator aggregator, FeatureExtractor extractor, ScoringService scoringService,
                             AlertRuleEngine alertRuleEngine, PipelineEventPublisher publisher,
                             PipelineCounters counters, Clock clock, PipelineProperties properties) {
        this.aggregator = aggregator;
        this.extractor = extractor;
        this.scoringService = scoringService;
        this.alertRuleEngine = alertRuleEngine;
        this.publisher = publisher;
        this.counters = counters;
        this.clock = clock;
        this.publishReadings = properties.getDispatch().isPublishReadings();
    }

    public void process(Reading reading) {
        List<Window> closed;
        try {
            if (publishReadings) {
                publisher.publish(PipelineEvent.readingAccepted(reading, clock.instant()));
            }
            alertRuleEngine.onReading(reading);
            closed = aggregator.append(reading);
        } catch (RuntimeException e) {
            failed("reading", reading.getSensorId(), reading.getEquipmentId(),
                    "timestamp=" + reading.getTimestamp() + " value=" + reading.getValue(), e);
            return;
        } finally {
            counters.increment(PipelineCounters.Counter.READINGS_PROCESSED);
        }
        for (Window window : closed) {
            processWindow(window);
        }
    }

    /** Closes stale windows of the selected sensors and runs them through the rest of the chain. */
    public void reap(Predicate<String> sensorFilter) {
        aggregator.reap(sensorFilter).forEach(this::processWindow);
    }

    /** Force-closes every open window of the selected sensors, used while shutting down. */
    public void flush(Predicate<String> sensorFilter) {
        aggregator.flush(sensorFilter).forEach(this::processWindow);
    }

    void processWindow(Window window) {
        try {
            publisher.publish(PipelineEvent.windowClosed(window.summary(), clock.instant()));
            ExtractionResult extraction = extractor.extract(window, aggregator.minReadingsOf(window.getSensorId()));
            if (!extraction.isOk()) {
                counters.increment(PipelineCounters.Counter.WINDOWS_DROPPED_INSUFFICIENT_DATA);
                log.info("Window dropped, insufficient data sensorId={} sequence={} readings={} minReadings={}",
                        window.getSensorId(), window.getSequence(), extraction.getReadingCount(),
                        extraction.getMinReadings());
                publisher.diagnostic(DiagnosticEvent.builder()
                        .type(DiagnosticType.WINDOW_DROPPED)
                        .sensorId(window.getSensorId())
                        .equipmentId(window.getEquipmentId())
                        .message("window below minimum reading count")
                        .detail("readings", extraction.getReadingCount())
                        .detail("minReadings", extraction.getMinReadings())
                        .at(clock.instant())
                        .build());
                return;
            }
            FeatureVector vector = extraction.getVector();
            counters.increment(PipelineCounters.Counter.FEATURE_VECTORS);
            Optional<PredictionResult> prediction = scoringService.score(vector);
            if (prediction.isPresent()) {
                publisher.publish(PipelineEvent.predictionProduced(prediction.get(), clock.instant()));
                alertRuleEngine.onPrediction(prediction.get());
            }
        } catch (RuntimeException e) {
            failed("window", window.getSensorId(), window.getEquipmentId(),
                    "sequence=" + window.getSequence() + " start=" + window.getStart() + " end=" + window.getEnd()
                            + " readings=" + window.size(), e);
        }
    }

    private void failed(String unit, String sensorId, String equipmentId, String context, RuntimeException e) {
        counters.increment(PipelineCounters.Counter.PROCESSING_ERRORS);
        log.error("Pipeline unit dropped unit={} sensorId={} equipmentId={} {} err={}", unit, sensorId, equipmentId,
                context, e.getMessage(), e);
        try {
            publisher.diagnostic(DiagnosticEvent.builder()
                    .type(DiagnosticType.INVARIANT_VIOLATION)
                    .sensorId(sensorId)
                    .equipmentId(equipmentId)
                    .message(unit + " dropped: " + e.getClass().getSimpleName() + ": " + e.getMessage())
                    .detail("context", context)
                    .at(clock.instant())
                    .build());
        } catch (RuntimeException publishError) {
            log.error("Failed to publish processing diagnostic sensorId={} err={}", sensorId,
                    publishError.getMessage());
        }
    }
}
