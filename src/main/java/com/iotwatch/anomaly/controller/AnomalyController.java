package com.iotwatch.anomaly.controller;

import com.iotwatch.anomaly.dispatch.sink.MongoAnomalySink;
import com.iotwatch.anomaly.model.AnomalyRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read path of the anomaly store.
 */
@RestController
@RequestMapping("/api/v1/anomalies")
@Slf4j
public class AnomalyController {

    private static final Duration DEFAULT_LOOKBACK = Duration.ofHours(24);

    private final MongoAnomalySink anomalyStore;

    public AnomalyController(MongoAnomalySink anomalyStore) {
        this.anomalyStore = anomalyStore;
    }

    /**
     * Anomalies of a device, newest first. Defaults to the last 24 hours.
     */
    @GetMapping
    public ResponseEntity<?> byDevice(
            @RequestParam String deviceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(DEFAULT_LOOKBACK);
        if (deviceId.isBlank() || start.isAfter(end)) {
            return ResponseEntity.badRequest().body(Map.of("error", "deviceId required and from must not be after to"));
        }
        List<AnomalyRecord> anomalies = anomalyStore.findByDevice(deviceId, start, end);
        log.debug("[ANOMALY-API] {} anomalies for {} in [{}, {}]", anomalies.size(), deviceId, start, end);
        return ResponseEntity.ok(anomalies);
    }
}
