package com.sandy.aiot.vision.pipeline.service.reload;

import com.sandy.aiot.vision.pipeline.model.AlertRule;
import com.sandy.aiot.vision.pipeline.model.EquipmentDefinition;
import com.sandy.aiot.vision.pipeline.model.SensorDefinition;
import com.sandy.aiot.vision.pipeline.service.scoring.ScorerBinding;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Hot-reloadable part of the configuration. A null section leaves the current one untouched.
 */
@Data
public class RuntimeConfig {
    private List<EquipmentDefinition> equipment;
    private List<SensorDefinition> sensors;
    private List<AlertRule> rules;
    private Map<String, ScorerBinding> bindings;
    private ScorerBinding defaultBinding;
}
