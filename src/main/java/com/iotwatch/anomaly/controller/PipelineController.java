package com.iotwatch.anomaly.controller;

import com.iotwatch.anomaly.dispatch.FailureReporter;
import com.iotwatch.anomaly.model.OperatorFailure;
import com.iotwatch.anomaly.pipeline.TelemetryPipeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Pipeline counters, queue depths and recent operator failures.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final TelemetryPipeline pipeline;
    private final FailureReporter failureReporter;

    public PipelineController(TelemetryPipeline pipeline, FailureReporter failureReporter) {
        this.pipeline = pipeline;
        this.failureReporter = failureReporter;
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(pipeline.stats());
    }

    @GetMapping("/failures")
    public ResponseEntity<List<OperatorFailure>> failures() {
        return ResponseEntity.ok(failureReporter.recent());
    }
}
