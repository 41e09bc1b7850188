package com.sandy.aiot.vision.pipeline.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "prediction_records", indexes = @Index(name = "idx_prediction_records_sensor_ts", columnList = "sensorId,timestamp"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 120)
    private String modelId;
    @Column(length = 120)
    private String equipmentId;
    @Column(length = 120)
    private String sensorId;

    private double score;
    private double confidence;
    private boolean anomaly;
    private boolean stale;

    /** End of the window the prediction was computed from. */
    private Instant timestamp;

    /** Input feature snapshot as JSON. */
    @Column(length = 4000)
    private String features;
}
