package com.sandy.aiot.vision.pipeline.controller;

import com.sandy.aiot.vision.pipeline.model.AlertRule;
import com.sandy.aiot.vision.pipeline.service.alert.RuleBook;
import com.sandy.aiot.vision.pipeline.service.reload.RuntimeConfigService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Alert rule management. Derived limit rules are listed but cannot be edited here.
 */
@RestController
@RequestMapping("/pipeline/api/rules")
@RequiredArgsConstructor
public class RuleController {

    private final RuleBook ruleBook;
    private final RuntimeConfigService runtimeConfigService;

    @GetMapping
    public List<AlertRule> list() {
        return ruleBook.rules();
    }

    @PutMapping
    public ResponseEntity<ActionResp> replace(@RequestBody List<AlertRule> rules) {
        try {
            runtimeConfigService.replaceRules(rules);
            return ResponseEntity.ok(ActionResp.ok());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.ok(ActionResp.fail(e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<ActionResp> upsert(@RequestBody AlertRule rule) {
        try {
            runtimeConfigService.upsertRule(rule);
            return ResponseEntity.ok(ActionResp.ok(rule.getId()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.ok(ActionResp.fail(e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ActionResp> delete(@PathVariable String id) {
        if (!runtimeConfigService.deleteRule(id)) return ResponseEntity.ok(ActionResp.fail("Rule not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }
}
