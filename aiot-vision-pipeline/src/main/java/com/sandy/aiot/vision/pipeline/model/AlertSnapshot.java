package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of an alert instance handed to subscribers and REST callers.
 */
@Value
@Builder
public class AlertSnapshot {
    Long id;
    String ruleId;
    String ruleName;
    ScopeType scope;
    String scopeKey;
    String equipmentId;
    String sensorId;
    Severity severity;
    AlertState state;
    boolean suppressed;
    String message;
    Double triggerValue;
    Double lastValue;
    Instant conditionSince;
    Instant triggeredAt;
    Instant lastObservedAt;
    Instant acknowledgedAt;
    String acknowledgedBy;
    Instant resolvedAt;
    String resolvedBy;
    List<AlertAnnotation> annotations;
}
