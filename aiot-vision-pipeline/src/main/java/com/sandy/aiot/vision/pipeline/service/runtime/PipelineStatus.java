package com.sandy.aiot.vision.pipeline.service.runtime;

import com.sandy.aiot.vision.pipeline.service.dispatch.SubscriptionStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class PipelineStatus {
    Instant at;
    boolean running;
    boolean accepting;
    int workers;
    Map<String, Long> counters;
    Map<String, Long> rejections;
    Map<String, Integer> bufferDepths;
    int bufferedReadings;
    long congestedLanes;
    int openWindows;
    int outboxSize;
    List<SubscriptionStats> subscribers;
    Map<String, Double> meanConfidence;
    Set<String> unavailableScorers;
    int openAlerts;
    /** Percentage of registered sensors without an open HIGH alert. */
    double systemHealth;
}
