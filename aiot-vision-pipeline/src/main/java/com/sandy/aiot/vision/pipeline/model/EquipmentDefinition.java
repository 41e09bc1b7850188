package com.sandy.aiot.vision.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentDefinition {
    private String id;
    private String name;
    /** Equipment type, used to pick the scorer binding (e.g. "CNC", "ROBOT"). */
    private String type;
    private String location;
    @Builder.Default
    private EquipmentStatus status = EquipmentStatus.ONLINE;
}
