package com.sandy.aiot.vision.pipeline.service.dispatch;

import com.sandy.aiot.vision.pipeline.model.PipelineEvent;

/**
 * Push-style consumer. An exception leaves the event unacknowledged and it is delivered again.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event) throws Exception;
}
