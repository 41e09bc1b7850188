package com.sandy.aiot.vision.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Unit of fan-out from the pipeline to its subscribers.
 * The payload type is fixed by {@link #type}: {@link Reading}, {@link WindowSummary},
 * {@link PredictionResult}, {@link AlertSnapshot} or {@link DiagnosticEvent}.
 */
@Value
@Builder
public class PipelineEvent {
    PipelineEventType type;
    Instant emittedAt;
    String sensorId;
    String equipmentId;
    Object payload;

    public static PipelineEvent readingAccepted(Reading reading, Instant now) {
        return of(PipelineEventType.READING_ACCEPTED, reading.getSensorId(), reading.getEquipmentId(), reading, now);
    }

    public static PipelineEvent windowClosed(WindowSummary window, Instant now) {
        return of(PipelineEventType.WINDOW_CLOSED, window.sensorId(), window.equipmentId(), window, now);
    }

    public static PipelineEvent predictionProduced(PredictionResult result, Instant now) {
        return of(PipelineEventType.PREDICTION_PRODUCED, result.getSensorId(), result.getEquipmentId(), result, now);
    }

    public static PipelineEvent alert(PipelineEventType type, AlertSnapshot alert, Instant now) {
        return of(type, alert.getSensorId(), alert.getEquipmentId(), alert, now);
    }

    public static PipelineEvent diagnostic(DiagnosticEvent diagnostic) {
        return of(PipelineEventType.DIAGNOSTIC, diagnostic.getSensorId(), diagnostic.getEquipmentId(), diagnostic,
                diagnostic.getAt());
    }

    private static PipelineEvent of(PipelineEventType type, String sensorId, String equipmentId, Object payload,
                                    Instant now) {
        return PipelineEvent.builder()
                .type(type)
                .emittedAt(now)
                .sensorId(sensorId)
                .equipmentId(equipmentId)
                .payload(payload)
                .build();
    }

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
