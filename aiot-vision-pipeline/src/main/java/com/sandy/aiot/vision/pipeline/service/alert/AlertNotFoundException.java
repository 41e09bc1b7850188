package com.sandy.aiot.vision.pipeline.service.alert;

public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(Long id) {
        super("Alert[id=" + id + "] not found");
    }
}
