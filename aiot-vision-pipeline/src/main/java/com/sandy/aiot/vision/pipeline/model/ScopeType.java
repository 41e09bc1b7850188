package com.sandy.aiot.vision.pipeline.model;

public enum ScopeType {
    GLOBAL,
    EQUIPMENT,
    SENSOR;

    /** Lower is narrower. */
    public int breadth() {
        switch (this) {
            case SENSOR:
                return 0;
            case EQUIPMENT:
                return 1;
            case GLOBAL:
                return 2;
            default:
                throw new IllegalStateException("Unexpected value: " + this);
        }
    }
}
