package com.sandy.aiot.vision.pipeline.model;

public enum EquipmentStatus {
    ONLINE,
    OFFLINE,
    MAINTENANCE,
    ERROR
}
