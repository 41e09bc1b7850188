package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.model.EventFilter;
import com.sandy.aiot.vision.pipeline.model.PipelineEventType;
import com.sandy.aiot.vision.pipeline.service.dispatch.ResultDispatcher;
import com.sandy.aiot.vision.pipeline.service.dispatch.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-sent event stream over a dispatcher subscription. A client that goes away is
 * unsubscribed on the first failed send.
 */
@RestController
@RequestMapping("/pipeline/api")
@RequiredArgsConstructor
@Slf4j
public class EventStreamController {

    private final ResultDispatcher dispatcher;

    @Value("${pipeline.sse.timeout-ms:0}")
    private long timeoutMs;

    @GetMapping("/events")
    public SseEmitter events(@RequestParam(required = false) Set<PipelineEventType> types,
                             @RequestParam(required = false) Set<String> sensorIds,
                             @RequestParam(required = false) Set<String> equipmentIds) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventFilter filter = EventFilter.builder().types(types).sensorIds(sensorIds).equipmentIds(equipmentIds).build();
        AtomicReference<Subscription> holder = new AtomicReference<>();
        Subscription subscription = dispatcher.subscribe("sse", filter, event -> {
            Subscription current = holder.get();
            if (current != null && current.isClosed()) return;
            try {
                emitter.send(SseEmitter.event().name(event.getType().name()).data(event));
            } catch (IOException | IllegalStateException e) {
                log.info("SSE client gone, unsubscribing reason={}", e.getMessage());
                if (current != null) dispatcher.unsubscribe(current);
            }
        });
        holder.set(subscription);
        emitter.onCompletion(() -> dispatcher.unsubscribe(subscription));
        emitter.onTimeout(() -> dispatcher.unsubscribe(subscription));
        emitter.onError(e -> dispatcher.unsubscribe(subscription));
        return emitter;
    }
}
