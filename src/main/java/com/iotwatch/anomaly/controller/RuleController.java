package com.iotwatch.anomaly.controller;

import com.iotwatch.anomaly.rule.AlertRule;
import com.iotwatch.anomaly.rule.RuleRegistry;
import com.iotwatch.anomaly.rule.RuleSet;
import com.iotwatch.anomaly.rule.RuleValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inspect and hot-reload alert rules.
 *
 * A rejected reload answers 400 with every validation error; the active rules stay in place.
 */
@RestController
@RequestMapping("/api/v1/rules")
@Slf4j
public class RuleController {

    private final RuleRegistry registry;

    public RuleController(RuleRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> current() {
        return ResponseEntity.ok(describe(registry.current()));
    }

    /**
     * Replace the whole rule set.
     */
    @PutMapping
    public ResponseEntity<Map<String, Object>> replace(@RequestBody List<AlertRule> rules) {
        try {
            RuleSet published = registry.reload(rules);
            return ResponseEntity.ok(describe(published));
        } catch (RuleValidationException e) {
            log.warn("[RULES] Rejected rule update: {}", e.getErrors());
            return ResponseEntity.badRequest().body(rejection(e));
        }
    }

    /**
     * Re-read the configured rule file.
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        try {
            RuleSet published = registry.reloadFromSource();
            return ResponseEntity.ok(describe(published));
        } catch (RuleValidationException e) {
            log.warn("[RULES] Rejected rule file reload: {}", e.getErrors());
            return ResponseEntity.badRequest().body(rejection(e));
        }
    }

    private Map<String, Object> describe(RuleSet ruleSet) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", ruleSet.getVersion());
        body.put("loadedAt", ruleSet.getLoadedAt().toString());
        body.put("rules", ruleSet.getRules());
        return body;
    }

    private Map<String, Object> rejection(RuleValidationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("errors", e.getErrors());
        body.put("activeVersion", registry.current().getVersion());
        return body;
    }
}
