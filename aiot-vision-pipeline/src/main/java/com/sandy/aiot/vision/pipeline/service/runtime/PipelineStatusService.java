package com.sandy.aiot.vision.pipeline.service.runtime;

import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.model.Severity;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.service.dispatch.ResultDispatcher;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionBuffer;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionService;
import com.sandy.aiot.vision.pipeline.service.ingest.ReadingValidator;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import com.sandy.aiot.vision.pipeline.service.scoring.ConfidenceDriftMonitor;
import com.sandy.aiot.vision.pipeline.service.scoring.ScoringService;
import com.sandy.aiot.vision.pipeline.service.window.WindowAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Point-in-time view over the pipeline's counters and queues.
 */
@Service
@RequiredArgsConstructor
public class PipelineStatusService {

    private final PipelineRuntime runtime;
    private final IngestionService ingestionService;
    private final ReadingValidator validator;
    private final IngestionBuffer buffer;
    private final WindowAggregator aggregator;
    private final ResultDispatcher dispatcher;
    private final ScoringService scoringService;
    private final ConfidenceDriftMonitor driftMonitor;
    private final AlertRuleEngine alertRuleEngine;
    private final SensorRegistry sensorRegistry;
    private final PipelineCounters counters;
    private final Clock clock;

    public PipelineStatus status() {
        List<AlertSnapshot> open = alertRuleEngine.openAlerts();
        return PipelineStatus.builder()
                .at(clock.instant())
                .running(runtime.isRunning())
                .accepting(ingestionService.isAccepting())
                .workers(runtime.workerCount())
                .counters(counters.snapshot())
                .rejections(validator.rejectionCounts())
                .bufferDepths(buffer.laneDepths())
                .bufferedReadings(buffer.totalDepth())
                .congestedLanes(buffer.congestedLanes())
                .openWindows(aggregator.openWindowCount())
                .outboxSize(dispatcher.outboxSize())
                .subscribers(dispatcher.stats())
                .meanConfidence(driftMonitor.meanConfidence())
                .unavailableScorers(scoringService.unavailableBindings())
                .openAlerts(open.size())
                .systemHealth(systemHealth(open))
                .build();
    }

    double systemHealth(List<AlertSnapshot> open) {
        int total = sensorRegistry.allSensors().size();
        if (total == 0) return 100.0;
        Set<String> critical = open.stream()
                .filter(a -> a.getSeverity() == Severity.HIGH && a.getSensorId() != null)
                .map(AlertSnapshot::getSensorId)
                .collect(Collectors.toSet());
        long healthy = sensorRegistry.allSensors().stream().filter(s -> !critical.contains(s.getId())).count();
        return Math.round(healthy * 1000.0 / total) / 10.0;
    }
}
