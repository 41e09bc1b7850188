package com.sandy.aiot.vision.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alert rule definition. Rules are loaded at startup and may be replaced at runtime;
 * the engine only ever works on validated copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {
    private String id;
    private String name;
    @Builder.Default
    private ScopeType scope = ScopeType.GLOBAL;
    /** Equipment id or sensor id; unused for GLOBAL rules. */
    private String target;
    private RuleCondition condition;
    @Builder.Default
    private Severity severity = Severity.MEDIUM;
    @Builder.Default
    private boolean enabled = true;

    /**
     * @throws IllegalArgumentException when the definition cannot be evaluated
     */
    public void validate() {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("rule id is required");
        if (scope == null) throw new IllegalArgumentException("rule " + id + ": scope is required");
        if (scope != ScopeType.GLOBAL && (target == null || target.isBlank())) {
            throw new IllegalArgumentException("rule " + id + ": " + scope + " scope requires a target");
        }
        if (condition == null || condition.getOperator() == null || condition.getThreshold() == null) {
            throw new IllegalArgumentException("rule " + id + ": condition needs an operator and a threshold");
        }
        if (condition.getSource() == null) {
            throw new IllegalArgumentException("rule " + id + ": condition source is required");
        }
        if (condition.getOperator().needsUpperThreshold()) {
            if (condition.getUpperThreshold() == null || condition.getUpperThreshold() < condition.getThreshold()) {
                throw new IllegalArgumentException("rule " + id + ": " + condition.getOperator()
                        + " needs upperThreshold >= threshold");
            }
        }
        if (condition.getSource() == ConditionSource.FEATURE
                && (condition.getFeature() == null || condition.getFeature().isBlank())) {
            throw new IllegalArgumentException("rule " + id + ": FEATURE condition needs a feature name");
        }
        if (condition.getEffectiveMinDuration().isNegative()) {
            throw new IllegalArgumentException("rule " + id + ": minDuration must not be negative");
        }
        if (severity == null) throw new IllegalArgumentException("rule " + id + ": severity is required");
    }

    public boolean matches(String sensorId, String equipmentId) {
        switch (scope) {
            case GLOBAL:
                return true;
            case EQUIPMENT:
                return target.equals(equipmentId);
            case SENSOR:
                return target.equals(sensorId);
            default:
                throw new IllegalStateException("Unexpected value: " + scope);
        }
    }

    /** Key of the state machine a given observation drives for this rule. */
    public String scopeKey(String sensorId, String equipmentId) {
        switch (scope) {
            case GLOBAL:
            case SENSOR:
                return "sensor:" + sensorId;
            case EQUIPMENT:
                return "equipment:" + equipmentId;
            default:
                throw new IllegalStateException("Unexpected value: " + scope);
        }
    }
}
