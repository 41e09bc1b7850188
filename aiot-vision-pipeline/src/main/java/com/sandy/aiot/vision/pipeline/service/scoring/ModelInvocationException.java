package com.sandy.aiot.vision.pipeline.service.scoring;

/** A loaded model failed to produce an output. */
public class ModelInvocationException extends RuntimeException {

    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
