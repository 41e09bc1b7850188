package com.sandy.aiot.vision.pipeline.service.alert;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.AlertAnnotation;
import com.sandy.aiot.vision.pipeline.model.AlertRule;
import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.model.ConditionSource;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;
import com.sandy.aiot.vision.pipeline.model.PipelineEventType;
import com.sandy.aiot.vision.pipeline.model.PredictionResult;
import com.sandy.aiot.vision.pipeline.model.Quality;
import com.sandy.aiot.vision.pipeline.model.Reading;
import com.sandy.aiot.vision.pipeline.model.RuleCondition;
import com.sandy.aiot.vision.pipeline.model.ScopeType;
import com.sandy.aiot.vision.pipeline.service.PipelineCounters;
import com.sandy.aiot.vision.pipeline.service.dispatch.PipelineEventPublisher;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Debounced, stateful evaluation of alert rules and the lifecycle of the alerts they raise.
 * <p>
 * Each (rule, scope key) pair has one track. A condition has to hold continuously, measured in
 * event time, for the rule's minimum duration before an alert is raised. While the alert is open
 * further matches only extend it; once it is resolved the track starts from scratch.
 * Equipment-scoped rules hold while any sensor of the equipment satisfies the condition.
 * <p>
 * Tracks are shared by the partition workers, so every track is guarded by its own monitor;
 * alert monitors are always taken inside track monitors, never the other way round.
 */
@Service
@Slf4j
public class AlertRuleEngine {

    private static final Comparator<AlertSnapshot> NEWEST_FIRST =
            Comparator.comparing(AlertSnapshot::getTriggeredAt).reversed()
                    .thenComparing(AlertSnapshot::getId, Comparator.reverseOrder());

    private final RuleBook ruleBook;
    private final SensorRegistry sensorRegistry;
    private final PipelineEventPublisher publisher;
    private final PipelineCounters counters;
    private final Clock clock;
    private final int resolvedRetention;
    private final boolean suppressBroaderScope;

    private final Map<TrackKey, RuleTrack> tracks = new ConcurrentHashMap<>();
    private final Map<Long, AlertInstance> alerts = new ConcurrentHashMap<>();
    private final ArrayDeque<Long> resolvedOrder = new ArrayDeque<>();
    private final AtomicLong ids = new AtomicLong();

    public AlertRuleEngine(RuleBook ruleBook, SensorRegistry sensorRegistry, PipelineProperties properties,
                           PipelineEventPublisher publisher, PipelineCounters counters, Clock clock) {
        this.ruleBook = ruleBook;
        this.sensorRegistry = sensorRegistry;
        this.publisher = publisher;
        this.counters = counters;
        this.clock = clock;
        this.resolvedRetention = Math.max(0, properties.getAlerts().getResolvedRetention());
        this.suppressBroaderScope = properties.getAlerts().isSuppressBroaderScope();
    }

    /** Evaluates the value rules against a reading. BAD-quality readings are ignored. */
    public void onReading(Reading reading) {
        if (reading.getQuality() == Quality.BAD) return;
        for (AlertRule rule : ruleBook.rules()) {
            if (!rule.isEnabled() || !rule.getCondition().getSource().appliesToReadings()) continue;
            if (!rule.matches(reading.getSensorId(), reading.getEquipmentId())) continue;
            evaluate(rule, reading.getSensorId(), reading.getEquipmentId(), reading.getValue(), reading.getTimestamp());
        }
    }

    /** Evaluates the score, confidence, anomaly and feature rules. Stale predictions are ignored. */
    public void onPrediction(PredictionResult prediction) {
        if (prediction.isStale()) return;
        for (AlertRule rule : ruleBook.rules()) {
            if (!rule.isEnabled() || rule.getCondition().getSource().appliesToReadings()) continue;
            if (!rule.matches(prediction.getSensorId(), prediction.getEquipmentId())) continue;
            Double observed = observe(rule.getCondition(), prediction);
            if (observed == null) continue;
            evaluate(rule, prediction.getSensorId(), prediction.getEquipmentId(), observed, prediction.getTimestamp());
        }
    }

    private static Double observe(RuleCondition condition, PredictionResult p) {
        ConditionSource source = condition.getSource();
        switch (source) {
            case SCORE:
                return p.getScore();
            case CONFIDENCE:
                return p.getConfidence();
            case ANOMALY:
                return p.isAnomaly() ? 1.0 : 0.0;
            case FEATURE:
                return p.getInputFeatureSnapshot() == null ? null : p.getInputFeatureSnapshot().get(condition.getFeature());
            default:
                throw new IllegalStateException("Unexpected value: " + source);
        }
    }

    private void evaluate(AlertRule rule, String sensorId, String equipmentId, double value, Instant at) {
        boolean holds = rule.getCondition().test(value);
        String scopeKey = rule.scopeKey(sensorId, equipmentId);
        RuleTrack track = tracks.computeIfAbsent(new TrackKey(rule.getId(), scopeKey), k -> new RuleTrack());
        AlertSnapshot triggered = null;
        synchronized (track) {
            boolean scopeHolds = holds;
            if (rule.getScope() == ScopeType.EQUIPMENT) {
                track.satisfiedBySensor.put(sensorId, holds);
                scopeHolds = track.satisfiedBySensor.containsValue(Boolean.TRUE);
            }
            if (!scopeHolds) {
                track.conditionSince = null;
                return;
            }
            if (track.open != null) {
                if (holds) track.open.observe(value, at);
                return;
            }
            if (track.conditionSince == null) {
                track.conditionSince = at;
            }
            Duration sustained = Duration.between(track.conditionSince, at);
            if (holds && sustained.compareTo(rule.getCondition().getEffectiveMinDuration()) >= 0) {
                AlertInstance instance = trigger(rule, scopeKey, sensorId, equipmentId, value, track.conditionSince, at);
                track.open = instance;
                triggered = instance.snapshot();
            }
        }
        if (triggered != null) {
            counters.increment(PipelineCounters.Counter.ALERTS_TRIGGERED);
            log.warn("Alert triggered id={} ruleId={} scopeKey={} severity={} value={} suppressed={}", triggered.getId(),
                    rule.getId(), scopeKey, rule.getSeverity(), value, triggered.isSuppressed());
            publisher.publish(PipelineEvent.alert(PipelineEventType.ALERT_TRIGGERED, triggered, clock.instant()));
        }
    }

    private AlertInstance trigger(AlertRule rule, String scopeKey, String sensorId, String equipmentId, double value,
                                  Instant since, Instant at) {
        boolean suppressed = sensorRegistry.isUnderMaintenance(equipmentId)
                || (suppressBroaderScope && narrowerOpen(rule.getScope(), sensorId, equipmentId));
        String message = String.format("%s: %s (observed %s on sensor %s)",
                rule.getName() != null ? rule.getName() : rule.getId(), rule.getCondition().describe(), value, sensorId);
        AlertInstance instance = new AlertInstance(ids.incrementAndGet(), rule.getId(), rule.getName(), rule.getScope(),
                scopeKey, equipmentId, sensorId, rule.getSeverity(), message, value, since, at, suppressed);
        alerts.put(instance.id, instance);
        return instance;
    }

    private boolean narrowerOpen(ScopeType scope, String sensorId, String equipmentId) {
        for (AlertInstance other : alerts.values()) {
            if (other.scope.breadth() >= scope.breadth() || !other.isOpen()) continue;
            if (sensorId.equals(other.sensorId)
                    || (other.scope == ScopeType.EQUIPMENT && equipmentId.equals(other.equipmentId))) {
                return true;
            }
        }
        return false;
    }

    public AlertSnapshot acknowledge(Long id, String actor, Instant at) {
        requireActor(actor, "acknowledge");
        AlertInstance instance = get(id);
        instance.acknowledge(actor.trim(), at != null ? at : clock.instant());
        AlertSnapshot snapshot = instance.snapshot();
        log.info("Alert acknowledged id={} by={}", id, snapshot.getAcknowledgedBy());
        publisher.publish(PipelineEvent.alert(PipelineEventType.ALERT_ACKNOWLEDGED, snapshot, clock.instant()));
        return snapshot;
    }

    /** Resolves the alert; the rule's track for that scope re-arms from scratch. */
    public AlertSnapshot resolve(Long id, String actor, Instant at) {
        requireActor(actor, "resolve");
        AlertInstance instance = get(id);
        RuleTrack track = tracks.get(new TrackKey(instance.ruleId, instance.scopeKey));
        if (track != null) {
            synchronized (track) {
                instance.resolve(actor.trim(), at != null ? at : clock.instant());
                if (track.open == instance) {
                    track.open = null;
                    track.conditionSince = null;
                    track.satisfiedBySensor.clear();
                }
            }
        } else {
            instance.resolve(actor.trim(), at != null ? at : clock.instant());
        }
        AlertSnapshot snapshot = instance.snapshot();
        retain(instance.id);
        log.info("Alert resolved id={} by={}", id, snapshot.getResolvedBy());
        publisher.publish(PipelineEvent.alert(PipelineEventType.ALERT_RESOLVED, snapshot, clock.instant()));
        return snapshot;
    }

    public AlertSnapshot suppress(Long id, String actor) {
        return changeSuppression(id, true, actor);
    }

    public AlertSnapshot unsuppress(Long id, String actor) {
        return changeSuppression(id, false, actor);
    }

    private AlertSnapshot changeSuppression(Long id, boolean value, String actor) {
        AlertInstance instance = get(id);
        boolean changed = instance.setSuppressed(value);
        AlertSnapshot snapshot = instance.snapshot();
        if (changed) {
            log.info("Alert suppression changed id={} suppressed={} by={}", id, value, actor);
            publisher.publish(PipelineEvent.alert(PipelineEventType.ALERT_SUPPRESSION_CHANGED, snapshot, clock.instant()));
        }
        return snapshot;
    }

    /** Annotations are accepted in every state, including resolved. */
    public AlertSnapshot annotate(Long id, String author, String text) {
        requireActor(author, "annotate");
        if (text == null || text.isBlank()) throw new AlertTransitionException("annotation text is required");
        AlertInstance instance = get(id);
        instance.annotate(new AlertAnnotation(clock.instant(), author.trim(), text.trim()));
        return instance.snapshot();
    }

    public Optional<AlertSnapshot> find(Long id) {
        AlertInstance instance = id == null ? null : alerts.get(id);
        return instance == null ? Optional.empty() : Optional.of(instance.snapshot());
    }

    /** Active and acknowledged alerts, newest first. */
    public List<AlertSnapshot> openAlerts() {
        return alerts.values().stream()
                .map(AlertInstance::snapshot)
                .filter(a -> a.getState().isOpen())
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public List<AlertSnapshot> recent(int limit) {
        return alerts.values().stream()
                .map(AlertInstance::snapshot)
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<AlertSnapshot> triggeredSince(Instant since) {
        return alerts.values().stream()
                .map(AlertInstance::snapshot)
                .filter(a -> !a.getTriggeredAt().isBefore(since))
                .sorted(Comparator.comparing(AlertSnapshot::getTriggeredAt))
                .collect(Collectors.toList());
    }

    /**
     * Called after the rule set changed. Pending debounce state is dropped so new conditions start
     * counting from the next observation; open alerts stay until an operator resolves them.
     */
    public void onRulesChanged() {
        tracks.entrySet().removeIf(e -> {
            RuleTrack track = e.getValue();
            synchronized (track) {
                track.conditionSince = null;
                track.satisfiedBySensor.clear();
                return track.open == null;
            }
        });
        log.info("Rule tracks reset after rule change openTracks={}", tracks.size());
    }

    private AlertInstance get(Long id) {
        AlertInstance instance = id == null ? null : alerts.get(id);
        if (instance == null) throw new AlertNotFoundException(id);
        return instance;
    }

    private void retain(long resolvedId) {
        synchronized (resolvedOrder) {
            resolvedOrder.addLast(resolvedId);
            while (resolvedOrder.size() > resolvedRetention) {
                alerts.remove(resolvedOrder.pollFirst());
            }
        }
    }

    private static void requireActor(String actor, String action) {
        if (actor == null || actor.isBlank()) {
            throw new AlertTransitionException("an actor is required to " + action + " an alert");
        }
    }

    private record TrackKey(String ruleId, String scopeKey) {
    }

    private static final class RuleTrack {
        private final Map<String, Boolean> satisfiedBySensor = new HashMap<>();
        private Instant conditionSince;
        private AlertInstance open;
    }
}
