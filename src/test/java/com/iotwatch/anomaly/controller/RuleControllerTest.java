package com.iotwatch.anomaly.controller;

import com.iotwatch.anomaly.rule.AlertRule;
import com.iotwatch.anomaly.rule.RuleRegistry;
import com.iotwatch.anomaly.support.RecordingSinks;
import com.iotwatch.anomaly.support.TestRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuleController")
class RuleControllerTest {

    private RuleRegistry registry;
    private RuleController controller;

    @BeforeEach
    void setUp() {
        registry = TestRules.registry(List.of(new RecordingSinks.Channel("log")));
        registry.reload(List.of(TestRules.hotRule("hot", 100, Duration.ofSeconds(60))));
        controller = new RuleController(registry);
    }

    @Test
    @DisplayName("GET returns the active version and rules")
    void current() {
        ResponseEntity<Map<String, Object>> response = controller.current();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1L, response.getBody().get("version"));
        assertEquals(1, ((List<?>) response.getBody().get("rules")).size());
    }

    @Test
    @DisplayName("PUT with valid rules publishes a new version")
    void replaceValid() {
        ResponseEntity<Map<String, Object>> response = controller.replace(List.of(
            TestRules.hotRule("hot", 90, Duration.ZERO), TestRules.hotRule("very-hot", 120, Duration.ZERO)));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(2L, response.getBody().get("version"));
        assertEquals(2, registry.current().size());
    }

    @Test
    @DisplayName("PUT with invalid rules answers 400 with the errors and keeps the active set")
    void replaceInvalid() {
        AlertRule bad = TestRules.hotRule("hot", 90, Duration.ofSeconds(-1));

        ResponseEntity<Map<String, Object>> response = controller.replace(List.of(bad));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(false, response.getBody().get("success"));
        assertEquals(List.of("rule 'hot': cooldown must not be negative"), response.getBody().get("errors"));
        assertEquals(1L, response.getBody().get("activeVersion"));
        assertEquals(100.0, registry.current().find("hot").orElseThrow().getPredicate().getThreshold());
    }

    @Test
    @DisplayName("POST /reload re-reads the configured rule file")
    void reloadFromFile() {
        ResponseEntity<Map<String, Object>> response = controller.reload();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(2L, response.getBody().get("version"));
        assertTrue(registry.current().contains("humidity-saturation"));
    }
}
