package com.iotwatch.anomaly.pipeline;

import com.iotwatch.anomaly.aggregator.WindowAggregator;
import com.iotwatch.anomaly.classifier.AnomalyClassifier;
import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.config.ProcessingConstants;
import com.iotwatch.anomaly.dispatch.FailureReporter;
import com.iotwatch.anomaly.dispatch.SinkDispatcher;
import com.iotwatch.anomaly.engine.RuleEngine;
import com.iotwatch.anomaly.ingress.IngressAdapter;
import com.iotwatch.anomaly.ingress.IngressCursor;
import com.iotwatch.anomaly.ingress.IngressFailureException;
import com.iotwatch.anomaly.ingress.TelemetryStream;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.OperatorFailure;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.rule.RuleRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * TelemetryPipeline - wires ingress, partition workers and sink lanes together and owns
 * their lifecycle.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>one ingress thread polling the source and routing records by device</li>
 *   <li>one worker per partition (see {@link PartitionWorker})</li>
 *   <li>a scheduler posting idle-flush requests into every partition queue</li>
 *   <li>one worker per sink lane, owned by the {@link SinkDispatcher}</li>
 * </ul>
 *
 * <h2>Shutdown order</h2>
 * <ol>
 *   <li>stop polling</li>
 *   <li>drain partition queues and flush open windows</li>
 *   <li>drain sink lanes</li>
 *   <li>commit the source position, only if every stage drained</li>
 *   <li>close the source</li>
 * </ol>
 *
 * <p>Ingress retry exhaustion is the only terminal failure: it is reported, the pipeline
 * shuts down in the order above and ends in {@link State#FAILED}.</p>
 */
@Component
@Slf4j
public class TelemetryPipeline {

    private static final String LOG_PREFIX = "[PIPELINE]";

    public enum State {
        CREATED,
        RUNNING,
        STOPPING,
        STOPPED,
        FAILED
    }

    private final IngressAdapter ingress;
    private final AnomalyClassifier classifier;
    private final RuleRegistry registry;
    private final SinkDispatcher dispatcher;
    private final FailureReporter failureReporter;
    private final PipelineProperties properties;
    private final PipelineMetrics metrics;
    private final LongSupplier clock;

    private final DevicePartitioner partitioner;
    private final List<PartitionWorker> workers = new ArrayList<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final Object lifecycleLock = new Object();

    private volatile boolean polling;
    private volatile TelemetryStream stream;
    private volatile Thread ingressThread;
    private ScheduledExecutorService idleScheduler;

    public TelemetryPipeline(IngressAdapter ingress, AnomalyClassifier classifier, RuleRegistry registry,
                             SinkDispatcher dispatcher, FailureReporter failureReporter,
                             PipelineProperties properties, PipelineMetrics metrics) {
        this(ingress, classifier, registry, dispatcher, failureReporter, properties, metrics,
            System::currentTimeMillis);
    }

    TelemetryPipeline(IngressAdapter ingress, AnomalyClassifier classifier, RuleRegistry registry,
                      SinkDispatcher dispatcher, FailureReporter failureReporter,
                      PipelineProperties properties, PipelineMetrics metrics, LongSupplier clock) {
        this.ingress = ingress;
        this.classifier = classifier;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.failureReporter = failureReporter;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.partitioner = new DevicePartitioner(properties.getPartitions().getCount());
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.LOWEST_PRECEDENCE)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("{} Disabled by configuration", LOG_PREFIX);
            return;
        }
        start(IngressCursor.empty());
    }

    /**
     * Start consuming from {@code from}; an empty cursor resumes from the source's own
     * committed position.
     */
    public void start(IngressCursor from) {
        synchronized (lifecycleLock) {
            if (!state.compareAndSet(State.CREATED, State.RUNNING)) {
                throw new IllegalStateException("Pipeline cannot start from state " + state.get());
            }

            PipelineProperties.Window window = properties.getWindow();
            PipelineProperties.Partitions partitions = properties.getPartitions();
            log.info("{} Starting: source={}, partitions={}, window={} grace={} idleTimeout={}, rules={}",
                LOG_PREFIX, ingress.describeSource(), partitioner.getPartitions(), window.getSize(),
                window.getGrace(), window.getIdleTimeout(), registry.current());

            dispatcher.start();
            for (int i = 0; i < partitioner.getPartitions(); i++) {
                WindowAggregator aggregator = new WindowAggregator(window.getSize(), window.getGrace(),
                    window.getIdleTimeout(), window.getStateRetention(), metrics);
                PartitionWorker worker = new PartitionWorker(i, partitions.getQueueCapacity(),
                    partitions.getOfferTimeout(), aggregator, new RuleEngine(metrics), classifier, registry,
                    dispatcher, metrics);
                workers.add(worker);
                worker.start();
            }

            stream = ingress.open(from);
            polling = true;
            ingressThread = new Thread(this::ingressLoop, "telemetry-ingress");
            ingressThread.setDaemon(true);
            ingressThread.start();

            long checkMs = Math.max(1, window.getIdleCheckInterval().toMillis());
            idleScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "idle-flush-scheduler");
                t.setDaemon(true);
                return t;
            });
            idleScheduler.scheduleAtFixedRate(this::requestIdleFlush, checkMs, checkMs, TimeUnit.MILLISECONDS);

            log.info("{} Started successfully", LOG_PREFIX);
        }
    }

    @PreDestroy
    public void stop() {
        shutdown(State.STOPPED);
    }

    public State getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * Cursor after the last record handed to the partitions.
     */
    public IngressCursor position() {
        TelemetryStream current = stream;
        return current == null ? IngressCursor.empty() : current.position();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("state", state.get());
        stats.put("source", ingress.describeSource());
        stats.put("position", position().getNextOffsets());
        stats.put("ruleSetVersion", registry.current().getVersion());
        List<Map<String, Object>> partitionStats = new ArrayList<>();
        for (PartitionWorker worker : workers) {
            Map<String, Object> ps = new LinkedHashMap<>();
            ps.put("partition", worker.getPartition());
            ps.putAll(worker.stats());
            partitionStats.add(ps);
        }
        stats.put("partitions", partitionStats);
        stats.put("sinks", dispatcher.laneStats());
        stats.put("counters", metrics.snapshot());
        return stats;
    }

    @Scheduled(fixedRate = ProcessingConstants.STATS_LOG_INTERVAL_SECONDS, timeUnit = TimeUnit.SECONDS)
    public void logStats() {
        if (!isRunning()) {
            return;
        }
        int partitionDepth = workers.stream().mapToInt(PartitionWorker::queueDepth).sum();
        log.info("{} Stats: ingested={}, malformed={}, late={}, windows={}, anomalies={}, alerts={}, " +
                "suppressed={}, backpressureDrops={}, deadLettered={}, partitionQueue={}, sinkQueue={}",
            LOG_PREFIX, metrics.getRecordsIngested(), metrics.getMalformedTotal(),
            metrics.getLateRecordsDropped(), metrics.getWindowsEmitted(), metrics.getAnomaliesDetected(),
            metrics.getAlertsEmitted(), metrics.getSuppressedTotal(), metrics.getBackpressureDropsTotal(),
            metrics.getDeadLetteredTotal(), partitionDepth, dispatcher.totalQueueDepth());
    }

    private void ingressLoop() {
        Duration pollTimeout = properties.getIngress().getPollTimeout();
        try {
            while (polling) {
                List<TelemetryRecord> batch = stream.poll(pollTimeout);
                long arrival = clock.getAsLong();
                for (TelemetryRecord record : batch) {
                    workers.get(partitioner.partitionOf(record.getDeviceId())).submit(record, arrival);
                }
            }
        } catch (IngressFailureException e) {
            if (!polling) {
                log.info("{} Ingress stopped while retrying: {}", LOG_PREFIX, e.getMessage());
                return;
            }
            log.error("{} Ingress failed permanently at {}: {}", LOG_PREFIX, e.getLastPosition(), e.getMessage());
            failureReporter.report(OperatorFailure.Category.INGRESS_TERMINAL, "ingress:" + ingress.describeSource(),
                e.getMessage());
            shutdown(State.FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("{} Ingress thread interrupted", LOG_PREFIX);
        }
    }

    private void requestIdleFlush() {
        long now = clock.getAsLong();
        for (PartitionWorker worker : workers) {
            worker.requestIdleFlush(now);
        }
    }

    private void shutdown(State finalState) {
        synchronized (lifecycleLock) {
            State current = state.get();
            if (current != State.RUNNING) {
                if (current == State.CREATED) {
                    state.set(finalState);
                }
                return;
            }
            state.set(State.STOPPING);
            log.info("{} Shutting down ({})", LOG_PREFIX, finalState);
            Duration timeout = properties.getShutdownTimeout();

            polling = false;
            if (idleScheduler != null) {
                idleScheduler.shutdownNow();
            }
            Thread ingressWorker = ingressThread;
            if (ingressWorker != null && ingressWorker != Thread.currentThread()) {
                joinOrInterrupt(ingressWorker, timeout);
            }

            boolean drained = true;
            for (PartitionWorker worker : workers) {
                try {
                    drained &= worker.drainAndStop(timeout);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("{} Interrupted while draining partition {}", LOG_PREFIX, worker.getPartition());
                    drained = false;
                }
            }

            drained &= dispatcher.drainAndStop(timeout);

            TelemetryStream openStream = stream;
            if (openStream != null) {
                if (drained) {
                    openStream.commit();
                } else {
                    log.warn("{} Not committing {}: some records or deliveries did not drain, they will be " +
                        "read again on restart", LOG_PREFIX, openStream.position());
                }
                openStream.close();
            }

            state.set(finalState);
            log.info("{} Stopped in state {} at position {}", LOG_PREFIX, finalState, position());
        }
    }

    private void joinOrInterrupt(Thread thread, Duration timeout) {
        try {
            thread.join(Math.max(1, timeout.toMillis()));
            if (thread.isAlive()) {
                log.warn("{} {} did not stop within {}, interrupting", LOG_PREFIX, thread.getName(), timeout);
                thread.interrupt();
                thread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
