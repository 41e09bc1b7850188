package com.sandy.aiot.vision.pipeline.service.reload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.pipeline.config.PipelineProperties;
import com.sandy.aiot.vision.pipeline.model.AlertRule;
import com.sandy.aiot.vision.pipeline.model.EquipmentDefinition;
import com.sandy.aiot.vision.pipeline.model.EquipmentStatus;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.service.alert.RuleBook;
import com.sandy.aiot.vision.pipeline.service.registry.SensorRegistry;
import com.sandy.aiot.vision.pipeline.service.scoring.ModelRegistry;
import com.sandy.aiot.vision.pipeline.service.scoring.ScorerBinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies configuration changes while the pipeline runs, from the REST surface or from the
 * optional watched JSON file ({@code pipeline.reload.file}). Rule changes only affect
 * evaluations that happen after they are applied.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RuntimeConfigService {

    private final SensorRegistry sensorRegistry;
    private final RuleBook ruleBook;
    private final AlertRuleEngine alertRuleEngine;
    private final ModelRegistry modelRegistry;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    private long lastModified = -1L;

    /**
     * Applies every non-null section. Rules and bindings are validated before anything changes and
     * the catalogue is validated as a whole before it is swapped in, so an invalid section leaves
     * the whole configuration as it was.
     *
     * @throws IllegalArgumentException when a section is invalid
     */
    public synchronized void apply(RuntimeConfig config) {
        if (config.getRules() != null) ruleBook.validate(config.getRules());
        if (config.getBindings() != null) config.getBindings().values().forEach(ScorerBinding::validate);
        if (config.getDefaultBinding() != null) config.getDefaultBinding().validate();

        if (config.getSensors() != null || config.getEquipment() != null) {
            List<SensorDefinition> sensors = config.getSensors() != null
                    ? config.getSensors() : new ArrayList<>(sensorRegistry.allSensors());
            List<EquipmentDefinition> equipment = config.getEquipment() != null
                    ? config.getEquipment() : new ArrayList<>(sensorRegistry.allEquipment());
            sensorRegistry.replace(sensors, equipment);
            ruleBook.refreshDerived();
            alertRuleEngine.onRulesChanged();
        }
        if (config.getRules() != null) {
            replaceRules(config.getRules());
        }
        if (config.getBindings() != null || config.getDefaultBinding() != null) {
            modelRegistry.replaceBindings(
                    config.getBindings() != null ? config.getBindings() : modelRegistry.bindings(),
                    config.getDefaultBinding() != null ? config.getDefaultBinding()
                            : modelRegistry.defaultBinding().orElse(null));
        }
    }

    public void replaceRules(List<AlertRule> rules) {
        ruleBook.replace(rules);
        alertRuleEngine.onRulesChanged();
    }

    public void upsertRule(AlertRule rule) {
        ruleBook.upsert(rule);
        alertRuleEngine.onRulesChanged();
    }

    public boolean deleteRule(String ruleId) {
        boolean removed = ruleBook.remove(ruleId);
        if (removed) alertRuleEngine.onRulesChanged();
        return removed;
    }

    public boolean updateEquipmentStatus(String equipmentId, EquipmentStatus status) {
        return sensorRegistry.updateEquipmentStatus(equipmentId, status);
    }

    @Scheduled(fixedDelayString = "${pipeline.reload.interval-ms:10000}")
    public void checkReloadFile() {
        String path = properties.getReload().getFile();
        if (path == null || path.isBlank()) return;
        File file = new File(path);
        if (!file.isFile()) {
            log.debug("Reload file not found path={}", path);
            return;
        }
        long modified = file.lastModified();
        if (modified == lastModified) return;
        try {
            RuntimeConfig config = objectMapper.readValue(file, RuntimeConfig.class);
            apply(config);
            lastModified = modified;
            log.info("Runtime configuration reloaded path={}", path);
        } catch (IOException | IllegalArgumentException e) {
            lastModified = modified;
            log.error("Runtime configuration rejected, keeping current one path={} err={}", path, e.getMessage());
        }
    }
}
