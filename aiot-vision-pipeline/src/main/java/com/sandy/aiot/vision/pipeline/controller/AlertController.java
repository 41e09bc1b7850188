package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.model.AlertSnapshot;
import com.sandy.aiot.vision.pipeline.service.alert.AlertNotFoundException;
import com.sandy.aiot.vision.pipeline.service.alert.AlertRuleEngine;
import com.sandy.aiot.vision.pipeline.service.alert.AlertTransitionException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * REST endpoints for alert listing and operator actions.
 */
@RestController
@RequestMapping("/pipeline/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertRuleEngine alertRuleEngine;
    private final Clock clock;

    @GetMapping
    public List<AlertSnapshot> listOpen() {
        return alertRuleEngine.openAlerts();
    }

    @GetMapping("/recent")
    public List<AlertSnapshot> listRecent(@RequestParam(defaultValue = "50") int limit) {
        return alertRuleEngine.recent(Math.max(1, Math.min(limit, 500)));
    }

    @GetMapping("/stats")
    public Stats stats() {
        Stats s = new Stats();
        List<AlertSnapshot> open = alertRuleEngine.openAlerts();
        s.setActiveCount(open.size());
        Instant now = clock.instant();
        List<AlertSnapshot> recent = alertRuleEngine.triggeredSince(now.minus(24, ChronoUnit.HOURS));
        s.setRecent24hCount(recent.size());
        s.setSeverityActive(countBySeverity(open));
        s.setSeverityRecent24h(countBySeverity(recent));
        // hour buckets, last 12 hours including the current one
        LocalDateTime local = LocalDateTime.ofInstant(now, clock.getZone());
        Map<String, Integer> hourMap = new LinkedHashMap<>();
        for (int i = 11; i >= 0; i--) {
            LocalDateTime start = local.minusHours(i).truncatedTo(ChronoUnit.HOURS);
            hourMap.put(String.format("%02d:00", start.getHour()), 0);
        }
        Instant horizon = now.minus(12, ChronoUnit.HOURS);
        for (AlertSnapshot a : recent) {
            if (a.getTriggeredAt().isBefore(horizon)) continue;
            LocalDateTime ts = LocalDateTime.ofInstant(a.getTriggeredAt(), clock.getZone());
            hourMap.computeIfPresent(String.format("%02d:00", ts.getHour()), (k, v) -> v + 1);
        }
        s.setHourStats(hourMap.entrySet().stream().map(e -> {
            HourStat h = new HourStat();
            h.setHour(e.getKey());
            h.setCount(e.getValue());
            return h;
        }).collect(Collectors.toList()));
        return s;
    }

    private Map<String, Integer> countBySeverity(List<AlertSnapshot> alerts) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (AlertSnapshot a : alerts) {
            map.merge(a.getSeverity().name(), 1, Integer::sum);
        }
        return map;
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertSnapshot> get(@PathVariable Long id) {
        return alertRuleEngine.find(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<ActionResp> acknowledge(@PathVariable Long id, @RequestBody(required = false) ActionReq req) {
        ActionReq r = req != null ? req : new ActionReq();
        return act(() -> alertRuleEngine.acknowledge(id, r.getActor(), r.getAt()));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ActionResp> resolve(@PathVariable Long id, @RequestBody(required = false) ActionReq req) {
        ActionReq r = req != null ? req : new ActionReq();
        return act(() -> alertRuleEngine.resolve(id, r.getActor(), r.getAt()));
    }

    @PostMapping("/{id}/suppress")
    public ResponseEntity<ActionResp> suppress(@PathVariable Long id, @RequestBody(required = false) ActionReq req) {
        return act(() -> alertRuleEngine.suppress(id, req != null ? req.getActor() : null));
    }

    @PostMapping("/{id}/unsuppress")
    public ResponseEntity<ActionResp> unsuppress(@PathVariable Long id, @RequestBody(required = false) ActionReq req) {
        return act(() -> alertRuleEngine.unsuppress(id, req != null ? req.getActor() : null));
    }

    @PostMapping("/{id}/annotate")
    public ResponseEntity<ActionResp> annotate(@PathVariable Long id, @RequestBody AnnotateReq req) {
        return act(() -> alertRuleEngine.annotate(id, req.getAuthor(), req.getText()));
    }

    private ResponseEntity<ActionResp> act(Supplier<AlertSnapshot> action) {
        try {
            return ResponseEntity.ok(ActionResp.ok(action.get()));
        } catch (AlertNotFoundException e) {
            return ResponseEntity.ok(ActionResp.fail("Alert not found"));
        } catch (AlertTransitionException e) {
            return ResponseEntity.ok(ActionResp.fail(e.getMessage()));
        }
    }

    @Data
    public static class ActionReq {
        private String actor;
        /** Defaults to now. */
        private Instant at;
    }

    @Data
    public static class AnnotateReq {
        private String author;
        private String text;
    }

    @Data
    public static class HourStat { private String hour; private int count; }

    @Data
    public static class Stats {
        private int activeCount;
        private int recent24hCount;
        private Map<String, Integer> severityActive;
        private Map<String, Integer> severityRecent24h;
        private List<HourStat> hourStats;
    }
}
