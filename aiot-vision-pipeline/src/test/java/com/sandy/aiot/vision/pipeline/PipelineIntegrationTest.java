package com.sandy.aiot.vision.pipeline;

import com.sandy.aiot.vision.pipeline.entity.AlertRecord;
import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.model.AlertState;
import com.sandy.aiot.vision.pipeline.model.RawReading;
import com.sandy.aiot.vision.pipeline.repository.AlertRecordRepository;
import com.sandy.aiot.vision.pipeline.repository.PredictionRecordRepository;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters.Counter;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.service.ingest.IngestionService;
import com.sandy.aiot.vision.pipeline.service.ingest.SubmitResult;
import com.sandy.aiot.vision.pipeline.service.runtime.PipelineRuntime;
import com.sandy.aiot.vision.pipeline.support.Await;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PipelineIntegrationTest {
    @Autowired IngestionService ingestionService;
    @Autowired PipelineRuntime runtime;
    @Autowired PipelineCounters counters;
    @Autowired AlertRuleEngine alertRuleEngine;
    @Autowired AlertRecordRepository alertRecordRepository;
    @Autowired PredictionRecordRepository predictionRecordRepository;

    @AfterEach
    void resolveOpenAlerts() {
        for (AlertSnapshot a : alertRuleEngine.openAlerts()) {
            alertRuleEngine.resolve(a.getId(), "cleanup", null);
        }
    }

    @Test
    void readingsFlowIntoStoredPredictions() throws Exception {
        long windowsBefore = counters.get(Counter.WINDOWS_CLOSED);
        long vectorsBefore = counters.get(Counter.FEATURE_VECTORS);
        long predictionsBefore = counters.get(Counter.PREDICTIONS);
        long storedBefore = predictionRecordRepository.countBySensorId("s-temp");

        for (int i = 0; i < 24; i++) {
            SubmitResult r = ingestionService.submit(raw("s-temp", 20.0 + (i % 3)));
            assertTrue(r.isAccepted(), () -> "rejected: " + r.getReason());
        }
        assertTrue(runtime.awaitQuiescence(Duration.ofSeconds(10)));

        assertTrue(counters.get(Counter.WINDOWS_CLOSED) - windowsBefore >= 6);
        assertTrue(counters.get(Counter.FEATURE_VECTORS) - vectorsBefore >= 6);
        // the first two windows of a cold sensor only warm the baseline
        assertTrue(counters.get(Counter.PREDICTIONS) - predictionsBefore >= 4);
        assertTrue(Await.until(() -> predictionRecordRepository.countBySensorId("s-temp") - storedBefore >= 4,
                Duration.ofSeconds(5)));
        assertFalse(predictionRecordRepository.findTop50BySensorIdOrderByTimestampDesc("s-temp").isEmpty());
    }

    @Test
    void limitBreachRaisesAlertAndPersistsLifecycle() throws Exception {
        assertTrue(ingestionService.submit(raw("s-load", 150.0)).isAccepted());
        assertTrue(Await.until(() -> openAlertFor("load-high").isPresent(), Duration.ofSeconds(5)));
        AlertSnapshot alert = openAlertFor("load-high").orElseThrow();
        assertEquals("s-load", alert.getSensorId());
        assertEquals(AlertState.ACTIVE, alert.getState());
        assertEquals(150.0, alert.getTriggerValue());

        assertTrue(Await.until(() -> alertRecordRepository.findByAlertId(alert.getId()).isPresent(),
                Duration.ofSeconds(5)));

        alertRuleEngine.acknowledge(alert.getId(), "operator", null);
        assertTrue(Await.until(() -> alertRecordRepository.findByAlertId(alert.getId())
                .map(AlertRecord::getState).filter("ACKNOWLEDGED"::equals).isPresent(), Duration.ofSeconds(5)));
        AlertRecord record = alertRecordRepository.findByAlertId(alert.getId()).orElseThrow();
        assertEquals("operator", record.getAcknowledgedBy());
        assertEquals("MEDIUM", record.getSeverity());
    }

    @Test
    void criticalLimitRaisesDerivedHighAlert() throws Exception {
        assertTrue(ingestionService.submit(raw("s-temp", 99.0)).isAccepted());
        assertTrue(Await.until(() -> openAlertFor("limit:critical:s-temp").isPresent(), Duration.ofSeconds(5)));
        assertTrue(openAlertFor("limit:warning:s-temp").isPresent());
    }

    private Optional<AlertSnapshot> openAlertFor(String ruleId) {
        return alertRuleEngine.openAlerts().stream().filter(a -> a.getRuleId().equals(ruleId)).findFirst();
    }

    private static RawReading raw(String sensorId, double value) {
        return RawReading.builder()
                .sensorId(sensorId)
                .equipmentId("eq-1")
                .timestamp(Instant.now())
                .value(value)
                .quality("GOOD")
                .build();
    }
}
