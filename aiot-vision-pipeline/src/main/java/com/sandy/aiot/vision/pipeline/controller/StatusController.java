package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.model.EquipmentStatus;
import com.sandy.aiot.vision.pipeline.service.reload.RuntimeConfig;
import com.sandy.aiot.vision.pipeline.service.reload.RuntimeConfigService;
import com.sandy.aiot.vision.pipeline.service.runtime.PipelineStatus;
import com.sandy.aiot.vision.pipeline.service.runtime.PipelineStatusService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/pipeline/api")
@RequiredArgsConstructor
public class StatusController {

    private final PipelineStatusService statusService;
    private final RuntimeConfigService runtimeConfigService;

    @GetMapping("/status")
    public PipelineStatus status() {
        return statusService.status();
    }

    @PutMapping("/equipment/{id}/status")
    public ResponseEntity<ActionResp> updateEquipmentStatus(@PathVariable String id, @RequestBody StatusReq req) {
        if (req == null || req.getStatus() == null) return ResponseEntity.ok(ActionResp.fail("status is required"));
        if (!runtimeConfigService.updateEquipmentStatus(id, req.getStatus())) {
            return ResponseEntity.ok(ActionResp.fail("Equipment not found"));
        }
        return ResponseEntity.ok(ActionResp.ok());
    }

    /** Applies a partial runtime configuration; absent sections stay unchanged. */
    @PutMapping("/config")
    public ResponseEntity<ActionResp> applyConfig(@RequestBody RuntimeConfig config) {
        try {
            runtimeConfigService.apply(config);
            return ResponseEntity.ok(ActionResp.ok());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.ok(ActionResp.fail(e.getMessage()));
        }
    }

    @Data
    public static class StatusReq {
        private EquipmentStatus status;
    }
}
