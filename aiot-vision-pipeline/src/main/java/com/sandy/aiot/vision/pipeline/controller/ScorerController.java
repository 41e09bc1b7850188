package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.service.scoring.ModelRegistry;
import com.sandy.aiot.vision.pipeline.service.scoring.ScorerBinding;
import com.sandy.aiot.vision.pipeline.service.scoring.ScoringService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/pipeline/api/scorers")
@RequiredArgsConstructor
public class ScorerController {

    private final ModelRegistry modelRegistry;
    private final ScoringService scoringService;

    @GetMapping
    public Bindings list() {
        Bindings b = new Bindings();
        b.setDefaultBinding(modelRegistry.defaultBinding().orElse(null));
        b.setBindings(modelRegistry.bindings());
        b.setUnavailable(scoringService.unavailableBindings());
        return b;
    }

    @PutMapping("/{equipmentType}")
    public ResponseEntity<ActionResp> bind(@PathVariable String equipmentType, @RequestBody ScorerBinding binding) {
        try {
            modelRegistry.bind(equipmentType, binding);
            return ResponseEntity.ok(ActionResp.ok());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.ok(ActionResp.fail(e.getMessage()));
        }
    }

    @DeleteMapping("/{equipmentType}")
    public ResponseEntity<ActionResp> unbind(@PathVariable String equipmentType) {
        if (!modelRegistry.unbind(equipmentType)) return ResponseEntity.ok(ActionResp.fail("Binding not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }

    @Data
    public static class Bindings {
        private ScorerBinding defaultBinding;
        private Map<String, ScorerBinding> bindings;
        private Set<String> unavailable;
    }
}
