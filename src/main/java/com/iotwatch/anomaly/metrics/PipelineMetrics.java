package com.iotwatch.anomaly.metrics;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PipelineMetrics - counters for every drop, emission and delivery in the pipeline.
 *
 * Drops are never errors in this pipeline, so each drop category has its own
 * counter and the operations API exposes all of them.
 */
@Component
public class PipelineMetrics {

    // ==================== INGRESS ====================
    private final AtomicLong recordsIngested = new AtomicLong(0);
    private final Map<String, AtomicLong> malformedByReason = new ConcurrentHashMap<>();
    private final AtomicLong transportReconnects = new AtomicLong(0);

    // ==================== PROCESSING ====================
    private final AtomicLong lateRecordsDropped = new AtomicLong(0);
    private final AtomicLong windowsEmitted = new AtomicLong(0);
    private final AtomicLong idleFlushes = new AtomicLong(0);
    private final AtomicLong anomaliesDetected = new AtomicLong(0);
    private final AtomicLong alertsEmitted = new AtomicLong(0);
    private final Map<String, AtomicLong> suppressedByRule = new ConcurrentHashMap<>();
    private final AtomicLong processingErrors = new AtomicLong(0);

    // ==================== BACKPRESSURE ====================
    private final Map<String, AtomicLong> backpressureDropsByQueue = new ConcurrentHashMap<>();

    // ==================== DELIVERY ====================
    private final Map<String, AtomicLong> deliveredBySink = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> deadLetteredBySink = new ConcurrentHashMap<>();
    private final AtomicLong duplicateDeliveriesSkipped = new AtomicLong(0);
    private final AtomicLong deadLetterEvictions = new AtomicLong(0);

    public void incRecordsIngested() { recordsIngested.incrementAndGet(); }
    public void incMalformed(String reason) { counter(malformedByReason, reason).incrementAndGet(); }
    public void incTransportReconnect() { transportReconnects.incrementAndGet(); }
    public void incLateDropped() { lateRecordsDropped.incrementAndGet(); }
    public void incWindowsEmitted(int count) { windowsEmitted.addAndGet(count); }
    public void incIdleFlush() { idleFlushes.incrementAndGet(); }
    public void incAnomaly() { anomaliesDetected.incrementAndGet(); }
    public void incAlertEmitted() { alertsEmitted.incrementAndGet(); }
    public void incSuppressed(String ruleId) { counter(suppressedByRule, ruleId).incrementAndGet(); }
    public void incProcessingError() { processingErrors.incrementAndGet(); }
    public void incBackpressureDrop(String queue) { counter(backpressureDropsByQueue, queue).incrementAndGet(); }
    public void incDelivered(String sink) { counter(deliveredBySink, sink).incrementAndGet(); }
    public void incDeadLettered(String sink) { counter(deadLetteredBySink, sink).incrementAndGet(); }
    public void incDuplicateSkipped() { duplicateDeliveriesSkipped.incrementAndGet(); }
    public void incDeadLetterEviction() { deadLetterEvictions.incrementAndGet(); }

    public long getRecordsIngested() { return recordsIngested.get(); }
    public long getMalformedTotal() { return sum(malformedByReason); }
    public Map<String, Long> getMalformedByReason() { return toLongMap(malformedByReason); }
    public long getTransportReconnects() { return transportReconnects.get(); }
    public long getLateRecordsDropped() { return lateRecordsDropped.get(); }
    public long getWindowsEmitted() { return windowsEmitted.get(); }
    public long getIdleFlushes() { return idleFlushes.get(); }
    public long getAnomaliesDetected() { return anomaliesDetected.get(); }
    public long getAlertsEmitted() { return alertsEmitted.get(); }
    public long getSuppressedTotal() { return sum(suppressedByRule); }
    public Map<String, Long> getSuppressedByRule() { return toLongMap(suppressedByRule); }
    public long getProcessingErrors() { return processingErrors.get(); }
    public long getBackpressureDropsTotal() { return sum(backpressureDropsByQueue); }
    public Map<String, Long> getBackpressureDropsByQueue() { return toLongMap(backpressureDropsByQueue); }
    public Map<String, Long> getDeliveredBySink() { return toLongMap(deliveredBySink); }
    public long getDeadLetteredTotal() { return sum(deadLetteredBySink); }
    public Map<String, Long> getDeadLetteredBySink() { return toLongMap(deadLetteredBySink); }
    public long getDuplicateDeliveriesSkipped() { return duplicateDeliveriesSkipped.get(); }
    public long getDeadLetterEvictions() { return deadLetterEvictions.get(); }

    /**
     * Flat view for the operations API and periodic stats logging.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("recordsIngested", getRecordsIngested());
        out.put("malformedDropped", getMalformedByReason());
        out.put("transportReconnects", getTransportReconnects());
        out.put("lateRecordsDropped", getLateRecordsDropped());
        out.put("windowsEmitted", getWindowsEmitted());
        out.put("idleFlushes", getIdleFlushes());
        out.put("anomaliesDetected", getAnomaliesDetected());
        out.put("alertsEmitted", getAlertsEmitted());
        out.put("suppressedMatches", getSuppressedByRule());
        out.put("processingErrors", getProcessingErrors());
        out.put("backpressureDrops", getBackpressureDropsByQueue());
        out.put("delivered", getDeliveredBySink());
        out.put("deadLettered", getDeadLetteredBySink());
        out.put("duplicateDeliveriesSkipped", getDuplicateDeliveriesSkipped());
        out.put("deadLetterEvictions", getDeadLetterEvictions());
        return out;
    }

    private static AtomicLong counter(Map<String, AtomicLong> counters, String key) {
        return counters.computeIfAbsent(key, k -> new AtomicLong());
    }

    private static long sum(Map<String, AtomicLong> src) {
        return src.values().stream().mapToLong(AtomicLong::get).sum();
    }

    private static Map<String, Long> toLongMap(Map<String, AtomicLong> src) {
        Map<String, Long> out = new TreeMap<>();
        src.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }
}
