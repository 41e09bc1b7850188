package com.sandy.aiot.vision.pipeline.service.alert;

import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.AlertRule;
import com.sandy.aiot.vision.pipeline.model.ComparisonOperator;
import com.sandy.aiot.vision.pipeline.model.ConditionSource;
import com.sandy.aiot.vision.pipeline.model.RuleCondition;
import com.sandy.aiot.vision.pipeline.model.ScopeType;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.model.Severity;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current set of alert rules: the configured ones plus limit rules derived from the sensors'
 * warning and critical thresholds. Swapped atomically, evaluations see either the old or the new set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleBook {

    public static final String LIMIT_RULE_PREFIX = "limit:";

    private final PipelineProperties properties;
    private final SensorRegistry sensorRegistry;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(new Snapshot(Map.of(), List.of()));

    @PostConstruct
    public void init() {
        replace(properties.getRules());
    }

    /** Every enabled and disabled rule, configured ones first. */
    public List<AlertRule> rules() {
        return snapshot.get().effective();
    }

    public List<AlertRule> configuredRules() {
        return List.copyOf(snapshot.get().configured().values());
    }

    public Optional<AlertRule> find(String ruleId) {
        return snapshot.get().effective().stream().filter(r -> r.getId().equals(ruleId)).findFirst();
    }

    /**
     * @throws IllegalArgumentException when a rule is invalid or an id repeats; nothing is applied then
     */
    public void replace(List<AlertRule> rules) {
        publish(validate(rules));
    }

    /**
     * Checks a full rule set without applying it.
     *
     * @return validated copies keyed by rule id, in input order
     * @throws IllegalArgumentException when a rule is invalid, uses the reserved prefix or an id repeats
     */
    public Map<String, AlertRule> validate(List<AlertRule> rules) {
        Map<String, AlertRule> configured = new LinkedHashMap<>();
        for (AlertRule rule : rules) {
            AlertRule copy = validated(rule);
            if (configured.putIfAbsent(copy.getId(), copy) != null) {
                throw new IllegalArgumentException("duplicate rule id: " + copy.getId());
            }
        }
        return configured;
    }

    /** Adds or replaces one configured rule. */
    public void upsert(AlertRule rule) {
        AlertRule copy = validated(rule);
        Map<String, AlertRule> configured = new LinkedHashMap<>(snapshot.get().configured());
        configured.put(copy.getId(), copy);
        publish(configured);
    }

    public boolean remove(String ruleId) {
        Map<String, AlertRule> configured = new LinkedHashMap<>(snapshot.get().configured());
        if (configured.remove(ruleId) == null) return false;
        publish(configured);
        return true;
    }

    /** Recomputes the derived limit rules after the sensor catalogue changed. */
    public void refreshDerived() {
        publish(snapshot.get().configured());
    }

    private synchronized void publish(Map<String, AlertRule> configured) {
        List<AlertRule> effective = new ArrayList<>(configured.values());
        int derived = 0;
        if (properties.getAlerts().isDeriveLimitRules()) {
            for (SensorDefinition sensor : sensorRegistry.allSensors()) {
                if (sensor.getWarning() != null) {
                    effective.add(limitRule(sensor, "warning", sensor.getWarning(), Severity.MEDIUM));
                    derived++;
                }
                if (sensor.getCritical() != null) {
                    effective.add(limitRule(sensor, "critical", sensor.getCritical(), Severity.HIGH));
                    derived++;
                }
            }
        }
        snapshot.set(new Snapshot(Collections.unmodifiableMap(new LinkedHashMap<>(configured)),
                Collections.unmodifiableList(effective)));
        log.info("Rule book updated configured={} derived={}", configured.size(), derived);
    }

    private AlertRule limitRule(SensorDefinition sensor, String level, double limit, Severity severity) {
        return AlertRule.builder()
                .id(LIMIT_RULE_PREFIX + level + ":" + sensor.getId())
                .name((sensor.getName() != null ? sensor.getName() : sensor.getId()) + " above " + level + " limit")
                .scope(ScopeType.SENSOR)
                .target(sensor.getId())
                .condition(RuleCondition.builder()
                        .source(ConditionSource.VALUE)
                        .operator(ComparisonOperator.GT)
                        .threshold(limit)
                        .minDuration(properties.getAlerts().getLimitRuleDuration())
                        .build())
                .severity(severity)
                .enabled(true)
                .build();
    }

    private static AlertRule validated(AlertRule rule) {
        if (rule == null) throw new IllegalArgumentException("rule is required");
        AlertRule copy = copy(rule);
        copy.validate();
        if (copy.getId().startsWith(LIMIT_RULE_PREFIX)) {
            throw new IllegalArgumentException("rule id prefix '" + LIMIT_RULE_PREFIX + "' is reserved: " + copy.getId());
        }
        return copy;
    }

    private static AlertRule copy(AlertRule rule) {
        RuleCondition c = rule.getCondition();
        RuleCondition condition = c == null ? null : RuleCondition.builder()
                .source(c.getSource())
                .feature(c.getFeature())
                .operator(c.getOperator())
                .threshold(c.getThreshold())
                .upperThreshold(c.getUpperThreshold())
                .minDuration(c.getMinDuration())
                .build();
        return rule.toBuilder().condition(condition).build();
    }

    private record Snapshot(Map<String, AlertRule> configured, List<AlertRule> effective) {
    }
}
