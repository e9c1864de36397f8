package com.iotwatch.anomaly.pipeline;

import com.iotwatch.anomaly.aggregator.WindowAggregator;
import com.iotwatch.anomaly.classifier.AnomalyClassifier;
import com.iotwatch.anomaly.dispatch.SinkDispatcher;
import com.iotwatch.anomaly.engine.RuleEngine;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.AlertEvent;
import com.iotwatch.anomaly.model.AnnotatedRecord;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.model.WindowSnapshot;
import com.iotwatch.anomaly.rule.RuleRegistry;
import com.iotwatch.anomaly.util.BoundedStageQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PartitionWorker - single owner of the window and alert state of its devices.
 *
 * <p>Per record: classify against one rule-set snapshot, send anomalies out, fold the
 * record into its window, evaluate alert rules. A failure on one record is logged and
 * counted; the worker carries on with the next.</p>
 *
 * <p>Idle flushes arrive as tasks in the same queue, so only this worker's thread ever
 * mutates its aggregator and engine while it runs.</p>
 */
@Slf4j
public class PartitionWorker {

    private final int partition;
    private final String logPrefix;
    private final BoundedStageQueue<PartitionTask> queue;
    private final WindowAggregator aggregator;
    private final RuleEngine ruleEngine;
    private final AnomalyClassifier classifier;
    private final RuleRegistry registry;
    private final SinkDispatcher dispatcher;
    private final PipelineMetrics metrics;
    private final Thread thread;

    private volatile boolean running = true;
    private volatile boolean completed;

    public PartitionWorker(int partition, int queueCapacity, Duration offerTimeout,
                           WindowAggregator aggregator, RuleEngine ruleEngine,
                           AnomalyClassifier classifier, RuleRegistry registry,
                           SinkDispatcher dispatcher, PipelineMetrics metrics) {
        this.partition = partition;
        this.logPrefix = "[PARTITION-" + partition + "]";
        this.queue = new BoundedStageQueue<>("partition-" + partition, queueCapacity, offerTimeout, metrics);
        this.aggregator = aggregator;
        this.ruleEngine = ruleEngine;
        this.classifier = classifier;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.thread = new Thread(this::runLoop, "partition-" + partition);
        thread.setDaemon(true);
    }

    public void start() {
        thread.start();
    }

    public void submit(TelemetryRecord record, long arrivalMillis) throws InterruptedException {
        queue.put(PartitionTask.record(record, arrivalMillis));
    }

    /**
     * Ask the worker to flush idle devices. A full queue skips the request instead of
     * pushing a record out; the next tick asks again.
     *
     * @return true if the request was queued
     */
    public boolean requestIdleFlush(long nowMillis) {
        boolean queued = queue.offerNow(PartitionTask.idleFlush(nowMillis));
        if (!queued) {
            log.debug("{} Queue full, idle flush skipped", logPrefix);
        }
        return queued;
    }

    /**
     * Let the worker finish its queue and flush every open window.
     *
     * @return true if the worker processed its whole queue and flushed its windows in time
     */
    public boolean drainAndStop(Duration timeout) throws InterruptedException {
        running = false;
        thread.join(Math.max(1, timeout.toMillis()));
        if (thread.isAlive()) {
            log.warn("{} Drain timed out with {} tasks queued, interrupting", logPrefix, queue.size());
            thread.interrupt();
            thread.join(1000);
            return false;
        }
        return completed;
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("queueDepth", queue.size());
        stats.put("backpressureDrops", queue.dropped());
        stats.put("openWindows", aggregator.openWindowCount());
        stats.put("trackedDevices", aggregator.trackedDeviceCount());
        stats.put("trackedAlertPairs", ruleEngine.trackedPairCount());
        return stats;
    }

    public int getPartition() {
        return partition;
    }

    public int queueDepth() {
        return queue.size();
    }

    private void runLoop() {
        log.info("{} Worker started", logPrefix);
        try {
            while (running || !queue.isEmpty()) {
                PartitionTask task = queue.poll(Duration.ofMillis(100));
                if (task == null) {
                    continue;
                }
                if (task.getKind() == PartitionTask.Kind.RECORD) {
                    process(task.getRecord(), task.getWallClockMillis());
                } else {
                    flushIdle(task.getWallClockMillis());
                }
            }
            emitWindows(aggregator.flushAll());
            completed = true;
            log.info("{} Worker stopped", logPrefix);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} Worker interrupted, {} tasks left in queue", logPrefix, queue.size());
        } catch (RuntimeException e) {
            log.error("{} Worker failed with {} tasks left in queue: {}", logPrefix, queue.size(), e.getMessage(), e);
        }
    }

    void process(TelemetryRecord record, long arrivalMillis) throws InterruptedException {
        try {
            AnnotatedRecord annotated = classifier.classify(record, registry.current());
            if (annotated.isAnomaly()) {
                metrics.incAnomaly();
                dispatcher.dispatchAnomaly(annotated);
            }

            emitWindows(aggregator.ingest(record, arrivalMillis));

            List<AlertEvent> alerts = ruleEngine.evaluate(annotated);
            for (AlertEvent alert : alerts) {
                dispatcher.dispatchAlert(alert);
            }
        } catch (RuntimeException e) {
            metrics.incProcessingError();
            log.error("{} Failed to process record device={} ts={}: {}", logPrefix, record.getDeviceId(),
                record.getTimestamp(), e.getMessage(), e);
        }
    }

    private void flushIdle(long nowMillis) throws InterruptedException {
        try {
            emitWindows(aggregator.flushIdle(nowMillis));
        } catch (RuntimeException e) {
            metrics.incProcessingError();
            log.error("{} Idle flush failed: {}", logPrefix, e.getMessage(), e);
        }
    }

    private void emitWindows(List<WindowSnapshot> windows) throws InterruptedException {
        for (WindowSnapshot window : windows) {
            dispatcher.dispatchWindow(window);
        }
    }
}
