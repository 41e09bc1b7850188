package com.sandy.aiot.vision.pipeline.model;

public enum AlertState {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean isOpen() {
        return this != RESOLVED;
    }
}
