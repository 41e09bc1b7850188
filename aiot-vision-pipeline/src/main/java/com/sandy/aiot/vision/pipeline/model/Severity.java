package com.sandy.aiot.vision.pipeline.model;

/** Severity: LOW / MEDIUM / HIGH */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
