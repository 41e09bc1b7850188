package com.sandy.aiot.vision.pipeline.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persisted copy of the latest state of an alert, one row per alert id.
 */
@Entity
@Table(name = "alert_records", indexes = @Index(name = "idx_alert_records_alert_id", columnList = "alertId", unique = true))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Id assigned by the rule engine. */
    private Long alertId;

    @Column(length = 120)
    private String ruleId;
    @Column(length = 200)
    private String ruleName;
    @Column(length = 16)
    private String scope;
    @Column(length = 160)
    private String scopeKey;
    @Column(length = 120)
    private String equipmentId;
    @Column(length = 120)
    private String sensorId;

    /** LOW / MEDIUM / HIGH */
    @Column(length = 16)
    private String severity;
    /** ACTIVE / ACKNOWLEDGED / RESOLVED */
    @Column(length = 16)
    private String state;
    private boolean suppressed;

    @Column(length = 500)
    private String message;

    private Double triggerValue;
    private Double lastValue;

    private Instant triggeredAt;
    private Instant lastObservedAt;
    private Instant acknowledgedAt;
    @Column(length = 120)
    private String acknowledgedBy;
    private Instant resolvedAt;
    @Column(length = 120)
    private String resolvedBy;

    private int annotationCount;
    private Instant updatedAt;
}
