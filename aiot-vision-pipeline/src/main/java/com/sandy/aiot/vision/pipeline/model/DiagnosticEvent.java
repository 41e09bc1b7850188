package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class DiagnosticEvent {
    DiagnosticType type;
    String sensorId;
    String equipmentId;
    String modelId;
    String message;
    @Singular
    Map<String, Object> details;
    Instant at;
}
