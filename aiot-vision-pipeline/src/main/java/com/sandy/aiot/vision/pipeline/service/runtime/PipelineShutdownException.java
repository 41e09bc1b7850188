package com.sandy.aiot.vision.pipeline.service.runtime;

/** The pipeline could not drain within its shutdown timeout. */
public class PipelineShutdownException extends RuntimeException {

    public PipelineShutdownException(String message) {
        super(message);
    }
}
