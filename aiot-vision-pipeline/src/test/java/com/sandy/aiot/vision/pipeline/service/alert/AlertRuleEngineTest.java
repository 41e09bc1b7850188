package com.sandy.aiot.vision.pipeline.service.alert;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.*;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import com.sandy.aiot.vision.pipeline.support.Fixtures;
import com.sandy.aiot.vision.pipeline.support.MutableClock;
import com.sandy.aiot.vision.pipeline.support.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.sandy.aiot.vision.pipeline.support.Fixtures.T0;
import static com.sandy.aiot.vision.pipeline.support.Fixtures.reading;
import static org.junit.jupiter.api.Assertions.*;

class AlertRuleEngineTest {

    private PipelineProperties properties;
    private SensorRegistry registry;
    private RuleBook ruleBook;
    private RecordingPublisher publisher;
    private AlertRuleEngine engine;

    private static AlertRule rule(String id, ScopeType scope, String target, ConditionSource source,
                                  ComparisonOperator op, double threshold, Duration minDuration, Severity severity) {
        return AlertRule.builder()
                .id(id)
                .name(id)
                .scope(scope)
                .target(target)
                .severity(severity)
                .condition(RuleCondition.builder()
                        .source(source)
                        .operator(op)
                        .threshold(threshold)
                        .minDuration(minDuration)
                        .build())
                .build();
    }

    private static AlertRule loadHigh(Duration minDuration) {
        return rule("load-high", ScopeType.SENSOR, "load", ConditionSource.VALUE, ComparisonOperator.GT, 100,
                minDuration, Severity.HIGH);
    }

    private void start(AlertRule... rules) {
        properties = Fixtures.properties();
        properties.setRules(new ArrayList<>(List.of(rules)));
        registry = Fixtures.registry(properties);
        ruleBook = new RuleBook(properties, registry);
        ruleBook.init();
        publisher = new RecordingPublisher();
        engine = new AlertRuleEngine(ruleBook, registry, properties, publisher, new PipelineCounters(),
                new MutableClock(T0.plusSeconds(3600)));
    }

    private void feed(String sensorId, double value, long... seconds) {
        for (long s : seconds) {
            engine.onReading(reading(sensorId, T0.plusSeconds(s), value));
        }
    }

    @BeforeEach
    void setUp() {
        start(loadHigh(Duration.ofSeconds(10)));
    }

    @Test
    void conditionMustHoldForTheFullDuration() {
        feed("load", 120, 0, 5, 9);
        assertTrue(engine.openAlerts().isEmpty());

        feed("load", 120, 10);
        List<AlertSnapshot> open = engine.openAlerts();
        assertEquals(1, open.size());
        assertEquals(T0.plusSeconds(10), open.get(0).getTriggeredAt());
        assertEquals(T0, open.get(0).getConditionSince());
        assertEquals(AlertState.ACTIVE, open.get(0).getState());
        assertEquals(1, publisher.ofType(PipelineEventType.ALERT_TRIGGERED).size());
    }

    @Test
    void interruptionRestartsTheDebounce() {
        feed("load", 120, 0, 5, 9);
        feed("load", 50, 9);
        feed("load", 120, 10, 15);
        assertTrue(engine.openAlerts().isEmpty());
        feed("load", 120, 20);
        assertEquals(1, engine.openAlerts().size());
        assertEquals(T0.plusSeconds(10), engine.openAlerts().get(0).getConditionSince());
    }

    @Test
    void lifecycleActiveAcknowledgedResolved() {
        feed("load", 120, 0, 10);
        Long id = engine.openAlerts().get(0).getId();
        AlertSnapshot before = engine.find(id).orElseThrow();

        AlertSnapshot acked = engine.acknowledge(id, "alice", T0.plusSeconds(15));
        assertEquals(AlertState.ACKNOWLEDGED, acked.getState());
        assertEquals("alice", acked.getAcknowledgedBy());
        assertThrows(AlertTransitionException.class, () -> engine.acknowledge(id, "bob", T0.plusSeconds(16)));

        AlertSnapshot resolved = engine.resolve(id, "bob", T0.plusSeconds(20));
        assertEquals(AlertState.RESOLVED, resolved.getState());
        assertEquals(T0.plusSeconds(20), resolved.getResolvedAt());
        assertThrows(AlertTransitionException.class, () -> engine.resolve(id, "bob", T0.plusSeconds(21)));
        assertTrue(engine.openAlerts().isEmpty());
        assertEquals(1, engine.recent(10).size());

        // snapshots handed out earlier never change
        assertEquals(AlertState.ACTIVE, before.getState());
        assertNull(before.getAcknowledgedBy());
        assertEquals(1, publisher.ofType(PipelineEventType.ALERT_ACKNOWLEDGED).size());
        assertEquals(1, publisher.ofType(PipelineEventType.ALERT_RESOLVED).size());
    }

    @Test
    void activeAlertCanBeResolvedDirectly() {
        feed("load", 120, 0, 10);
        Long id = engine.openAlerts().get(0).getId();
        assertEquals(AlertState.RESOLVED, engine.resolve(id, "carol", T0.plusSeconds(11)).getState());
    }

    @Test
    void transitionsValidateActorTimeAndId() {
        feed("load", 120, 0, 10);
        Long id = engine.openAlerts().get(0).getId();
        assertThrows(AlertTransitionException.class, () -> engine.acknowledge(id, " ", T0.plusSeconds(15)));
        assertThrows(AlertTransitionException.class, () -> engine.acknowledge(id, "alice", T0.plusSeconds(5)));
        assertThrows(AlertNotFoundException.class, () -> engine.acknowledge(999L, "alice", T0.plusSeconds(15)));
        assertEquals(AlertState.ACTIVE, engine.find(id).orElseThrow().getState());
    }

    @Test
    void alertStaysOpenWhenConditionClears() {
        feed("load", 120, 0, 10);
        feed("load", 20, 11, 30, 60);
        AlertSnapshot alert = engine.openAlerts().get(0);
        assertEquals(AlertState.ACTIVE, alert.getState());
        assertEquals(120.0, alert.getLastValue());
    }

    @Test
    void furtherMatchesExtendTheOpenAlert() {
        feed("load", 120, 0, 10);
        feed("load", 130, 25);
        assertEquals(1, engine.recent(10).size());
        AlertSnapshot alert = engine.openAlerts().get(0);
        assertEquals(130.0, alert.getLastValue());
        assertEquals(T0.plusSeconds(25), alert.getLastObservedAt());
    }

    @Test
    void resolvedRuleRearmsFromScratch() {
        feed("load", 120, 0, 10);
        Long first = engine.openAlerts().get(0).getId();
        engine.resolve(first, "bob", T0.plusSeconds(20));

        feed("load", 120, 21, 30);
        assertTrue(engine.openAlerts().isEmpty());
        feed("load", 120, 31);
        AlertSnapshot second = engine.openAlerts().get(0);
        assertNotEquals(first, second.getId());
        assertEquals(T0.plusSeconds(21), second.getConditionSince());
    }

    @Test
    void rulesOnTheSameSensorAreIndependent() {
        start(loadHigh(Duration.ZERO),
                rule("load-extreme", ScopeType.SENSOR, "load", ConditionSource.VALUE, ComparisonOperator.GT, 150,
                        Duration.ZERO, Severity.HIGH));
        feed("load", 120, 0);
        assertEquals(1, engine.openAlerts().size());
        feed("load", 160, 1);
        assertEquals(2, engine.openAlerts().size());
        Long high = engine.openAlerts().stream().filter(a -> a.getRuleId().equals("load-high")).findFirst().orElseThrow().getId();
        engine.resolve(high, "bob", T0.plusSeconds(2));
        assertEquals("load-extreme", engine.openAlerts().get(0).getRuleId());
    }

    @Test
    void equipmentRuleRaisesOneAlertForAllItsSensors() {
        start(rule("press-hot", ScopeType.EQUIPMENT, "press-1", ConditionSource.VALUE, ComparisonOperator.GT, 100,
                Duration.ofSeconds(5), Severity.MEDIUM));
        feed("temp", 120, 0);
        feed("load", 120, 3);
        feed("temp", 20, 4);
        // load still holds, so the equipment condition held from 0s on
        feed("load", 120, 5);
        List<AlertSnapshot> open = engine.openAlerts();
        assertEquals(1, open.size());
        assertEquals("equipment:press-1", open.get(0).getScopeKey());
        feed("temp", 120, 6);
        assertEquals(1, engine.recent(10).size());
    }

    @Test
    void maintenanceStartsAlertsSuppressed() {
        start(loadHigh(Duration.ZERO));
        registry.updateEquipmentStatus("press-1", EquipmentStatus.MAINTENANCE);
        feed("load", 120, 0);
        AlertSnapshot alert = engine.openAlerts().get(0);
        assertTrue(alert.isSuppressed());

        AlertSnapshot unsuppressed = engine.unsuppress(alert.getId(), "alice");
        assertFalse(unsuppressed.isSuppressed());
        assertEquals(1, publisher.ofType(PipelineEventType.ALERT_SUPPRESSION_CHANGED).size());
        engine.unsuppress(alert.getId(), "alice");
        assertEquals(1, publisher.ofType(PipelineEventType.ALERT_SUPPRESSION_CHANGED).size());
    }

    @Test
    void predictionRulesIgnoreStaleResults() {
        start(rule("anomalous", ScopeType.SENSOR, "temp", ConditionSource.ANOMALY, ComparisonOperator.EQ, 1,
                Duration.ZERO, Severity.HIGH));
        PredictionResult stale = PredictionResult.builder()
                .modelId("z").sensorId("temp").equipmentId("press-1")
                .score(9).confidence(1).anomaly(true).stale(true)
                .timestamp(T0).inputFeatureSnapshot(Map.of("mean", 1.0))
                .build();
        engine.onPrediction(stale);
        assertTrue(engine.openAlerts().isEmpty());

        engine.onPrediction(stale.toBuilder().stale(false).build());
        assertEquals(1, engine.openAlerts().size());
    }

    @Test
    void annotationsAccumulate() {
        feed("load", 120, 0, 10);
        Long id = engine.openAlerts().get(0).getId();
        engine.annotate(id, "alice", "checking the hydraulics");
        engine.resolve(id, "alice", T0.plusSeconds(30));
        AlertSnapshot s = engine.annotate(id, "bob", "seal replaced");
        assertEquals(2, s.getAnnotations().size());
        assertEquals("seal replaced", s.getAnnotations().get(1).text());
    }

    @Test
    void ruleChangeDropsPendingDebounce() {
        feed("load", 120, 0, 5);
        engine.onRulesChanged();
        feed("load", 120, 10);
        assertTrue(engine.openAlerts().isEmpty());
        feed("load", 120, 20);
        assertEquals(1, engine.openAlerts().size());
    }

    @Test
    void triggeredSinceFiltersByTriggerTime() {
        start(loadHigh(Duration.ZERO));
        feed("load", 120, 0);
        Instant cut = T0.plusSeconds(1);
        assertTrue(engine.triggeredSince(cut).isEmpty());
        assertEquals(1, engine.triggeredSince(T0).size());
    }
}
