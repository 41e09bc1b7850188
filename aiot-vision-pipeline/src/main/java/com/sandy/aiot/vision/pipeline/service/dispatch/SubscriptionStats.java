package com.sandy.aiot.vision.pipeline.service.dispatch;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubscriptionStats {
    long id;
    String name;
    boolean listener;
    int pending;
    int capacity;
    long delivered;
    long acknowledged;
    long dropped;
    long expired;
    long handlerFailures;
    boolean lagging;
}
