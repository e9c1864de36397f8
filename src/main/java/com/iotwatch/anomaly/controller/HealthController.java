package com.iotwatch.anomaly.controller;

import com.iotwatch.anomaly.pipeline.TelemetryPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Liveness and readiness probes.
 */
@RestController
@RequestMapping("/api/v1/health")
@Slf4j
public class HealthController {

    private final TelemetryPipeline pipeline;

    public HealthController(TelemetryPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Liveness probe - Is the application running?
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> liveness() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    /**
     * Readiness probe - Is the pipeline consuming?
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        boolean isReady = pipeline.isRunning();

        Map<String, Object> response = new HashMap<>();
        response.put("status", isReady ? "UP" : "DOWN");
        response.put("pipelineState", pipeline.getState());
        response.put("timestamp", System.currentTimeMillis());

        if (!isReady) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
