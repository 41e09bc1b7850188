package com.sandy.aiot.vision.pipeline.service.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.entity.AlertRecord;
import com.sandy.aiot.vision.pipeline.entity.PredictionRecord;
import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.model.EventFilter;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;
import com.sandy.aiot.vision.pipeline.model.PipelineEventType;
import com.sandy.aiot.vision.pipeline.model.PredictionResult;
import com.sandy.aiot.vision.pipeline.repository.AlertRecordRepository;
import com.sandy.aiot.vision.pipeline.repository.PredictionRecordRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Set;

/**
 * Persists prediction and alert snapshots through a listener subscription. A failing write is
 * retried by the dispatcher, so alert rows are upserted by alert id.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotStoreSubscriber {

    private final ResultDispatcher dispatcher;
    private final AlertRecordRepository alertRecordRepository;
    private final PredictionRecordRepository predictionRecordRepository;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;
    private final Clock clock;

    @PostConstruct
    public void register() {
        if (!properties.getDispatch().isStoreEnabled()) {
            log.info("Snapshot store disabled");
            return;
        }
        dispatcher.subscribe("snapshot-store", EventFilter.builder()
                .types(Set.of(PipelineEventType.PREDICTION_PRODUCED, PipelineEventType.ALERT_TRIGGERED,
                        PipelineEventType.ALERT_ACKNOWLEDGED, PipelineEventType.ALERT_RESOLVED,
                        PipelineEventType.ALERT_SUPPRESSION_CHANGED))
                .build(), this::store);
    }

    void store(PipelineEvent event) throws JsonProcessingException {
        if (event.getType() == PipelineEventType.PREDICTION_PRODUCED) {
            storePrediction(event.payloadAs(PredictionResult.class));
        } else {
            storeAlert(event.payloadAs(AlertSnapshot.class));
        }
    }

    private void storePrediction(PredictionResult p) throws JsonProcessingException {
        predictionRecordRepository.save(PredictionRecord.builder()
                .modelId(p.getModelId())
                .equipmentId(p.getEquipmentId())
                .sensorId(p.getSensorId())
                .score(p.getScore())
                .confidence(p.getConfidence())
                .anomaly(p.isAnomaly())
                .stale(p.isStale())
                .timestamp(p.getTimestamp())
                .features(objectMapper.writeValueAsString(p.getInputFeatureSnapshot()))
                .build());
    }

    private void storeAlert(AlertSnapshot a) {
        AlertRecord record = alertRecordRepository.findByAlertId(a.getId()).orElseGet(AlertRecord::new);
        record.setAlertId(a.getId());
        record.setRuleId(a.getRuleId());
        record.setRuleName(a.getRuleName());
        record.setScope(a.getScope().name());
        record.setScopeKey(a.getScopeKey());
        record.setEquipmentId(a.getEquipmentId());
        record.setSensorId(a.getSensorId());
        record.setSeverity(a.getSeverity().name());
        record.setState(a.getState().name());
        record.setSuppressed(a.isSuppressed());
        record.setMessage(truncate(a.getMessage(), 500));
        record.setTriggerValue(a.getTriggerValue());
        record.setLastValue(a.getLastValue());
        record.setTriggeredAt(a.getTriggeredAt());
        record.setLastObservedAt(a.getLastObservedAt());
        record.setAcknowledgedAt(a.getAcknowledgedAt());
        record.setAcknowledgedBy(a.getAcknowledgedBy());
        record.setResolvedAt(a.getResolvedAt());
        record.setResolvedBy(a.getResolvedBy());
        record.setAnnotationCount(a.getAnnotations() == null ? 0 : a.getAnnotations().size());
        record.setUpdatedAt(clock.instant());
        alertRecordRepository.save(record);
        log.debug("Alert snapshot stored alertId={} state={}", a.getId(), a.getState());
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
