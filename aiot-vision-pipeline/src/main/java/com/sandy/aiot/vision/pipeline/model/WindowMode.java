package com.sandy.aiot.vision.pipeline.model;

public enum WindowMode {
    COUNT,
    DURATION
}
