package com.sandy.aiot.vision.pipeline.service.dispatch;

import com.sandy.aiot.vision.pipeline.model.DiagnosticEvent;
import com.sandy.aiot.vision.pipeline.model.PipelineEvent;

/**
 * Sink the pipeline stages publish into. Implementations must not throw back into the caller.
 */
public interface PipelineEventPublisher {

    void publish(PipelineEvent event);

    default void diagnostic(DiagnosticEvent diagnostic) {
        publish(PipelineEvent.diagnostic(diagnostic));
    }
}
