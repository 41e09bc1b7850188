package com.sandy.aiot.vision.pipeline.service.alert;

import com.sandy.aiot.vision.pipeline.model.AlertAnnotation;
import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.model.AlertState;
import com.sandy.aiot.vision.pipeline.model.ScopeType;
import com.sandy.aiot.vision.pipeline.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable alert owned by the engine. Never leaves the package; callers get {@link AlertSnapshot}s.
 */
final class AlertInstance {

    final long id;
    final String ruleId;
    final String ruleName;
    final ScopeType scope;
    final String scopeKey;
    final String equipmentId;
    final String sensorId;
    final Severity severity;
    final String message;
    final double triggerValue;
    final Instant conditionSince;
    final Instant triggeredAt;

    private AlertState state = AlertState.ACTIVE;
    private boolean suppressed;
    private double lastValue;
    private Instant lastObservedAt;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private Instant resolvedAt;
    private String resolvedBy;
    private final List<AlertAnnotation> annotations = new ArrayList<>();

    AlertInstance(long id, String ruleId, String ruleName, ScopeType scope, String scopeKey, String equipmentId,
                  String sensorId, Severity severity, String message, double triggerValue, Instant conditionSince,
                  Instant triggeredAt, boolean suppressed) {
        this.id = id;
        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.scope = scope;
        this.scopeKey = scopeKey;
        this.equipmentId = equipmentId;
        this.sensorId = sensorId;
        this.severity = severity;
        this.message = message;
        this.triggerValue = triggerValue;
        this.conditionSince = conditionSince;
        this.triggeredAt = triggeredAt;
        this.suppressed = suppressed;
        this.lastValue = triggerValue;
        this.lastObservedAt = triggeredAt;
    }

    synchronized AlertState state() {
        return state;
    }

    synchronized boolean isOpen() {
        return state.isOpen();
    }

    synchronized void observe(double value, Instant at) {
        if (!state.isOpen()) return;
        lastValue = value;
        if (at.isAfter(lastObservedAt)) lastObservedAt = at;
    }

    synchronized void acknowledge(String actor, Instant at) {
        if (state != AlertState.ACTIVE) {
            throw new AlertTransitionException("Alert[id=" + id + "] cannot be acknowledged in state " + state);
        }
        requireNotBeforeTrigger(at, "acknowledged");
        state = AlertState.ACKNOWLEDGED;
        acknowledgedAt = at;
        acknowledgedBy = actor;
    }

    synchronized void resolve(String actor, Instant at) {
        if (!state.isOpen()) {
            throw new AlertTransitionException("Alert[id=" + id + "] is already resolved");
        }
        requireNotBeforeTrigger(at, "resolved");
        state = AlertState.RESOLVED;
        resolvedAt = at;
        resolvedBy = actor;
    }

    /** @return whether the flag changed */
    synchronized boolean setSuppressed(boolean value) {
        if (!state.isOpen()) {
            throw new AlertTransitionException("Alert[id=" + id + "] is resolved, suppression cannot change");
        }
        if (suppressed == value) return false;
        suppressed = value;
        return true;
    }

    synchronized void annotate(AlertAnnotation annotation) {
        annotations.add(annotation);
    }

    synchronized AlertSnapshot snapshot() {
        return AlertSnapshot.builder()
                .id(id)
                .ruleId(ruleId)
                .ruleName(ruleName)
                .scope(scope)
                .scopeKey(scopeKey)
                .equipmentId(equipmentId)
                .sensorId(sensorId)
                .severity(severity)
                .state(state)
                .suppressed(suppressed)
                .message(message)
                .triggerValue(triggerValue)
                .lastValue(lastValue)
                .conditionSince(conditionSince)
                .triggeredAt(triggeredAt)
                .lastObservedAt(lastObservedAt)
                .acknowledgedAt(acknowledgedAt)
                .acknowledgedBy(acknowledgedBy)
                .resolvedAt(resolvedAt)
                .resolvedBy(resolvedBy)
                .annotations(List.copyOf(annotations))
                .build();
    }

    private void requireNotBeforeTrigger(Instant at, String action) {
        if (at.isBefore(triggeredAt)) {
            throw new AlertTransitionException("Alert[id=" + id + "] cannot be " + action + " at " + at
                    + ", before it triggered at " + triggeredAt);
        }
    }
}
