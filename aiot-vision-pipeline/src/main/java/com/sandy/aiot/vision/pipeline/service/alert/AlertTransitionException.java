package com.sandy.aiot.vision.pipeline.service.alert;

/** Operator action not allowed in the alert's current state, or missing required input. */
public class AlertTransitionException extends RuntimeException {

    public AlertTransitionException(String message) {
        super(message);
    }
}
