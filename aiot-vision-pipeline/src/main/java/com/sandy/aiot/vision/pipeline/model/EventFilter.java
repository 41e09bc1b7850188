package com.sandy.aiot.vision.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Subscription filter. Empty or null sets match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventFilter {
    private Set<PipelineEventType> types;
    private Set<String> sensorIds;
    private Set<String> equipmentIds;

    public static EventFilter all() {
        return new EventFilter();
    }

    public static EventFilter ofTypes(PipelineEventType... types) {
        return EventFilter.builder().types(Set.of(types)).build();
    }

    public boolean matches(PipelineEvent event) {
        if (types != null && !types.isEmpty() && !types.contains(event.getType())) return false;
        if (sensorIds != null && !sensorIds.isEmpty() && !sensorIds.contains(event.getSensorId())) return false;
        return equipmentIds == null || equipmentIds.isEmpty() || equipmentIds.contains(event.getEquipmentId());
    }
}
