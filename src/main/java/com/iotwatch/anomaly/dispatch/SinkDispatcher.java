package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.AlertEvent;
import com.iotwatch.anomaly.model.AnnotatedRecord;
import com.iotwatch.anomaly.model.DeadLetter;
import com.iotwatch.anomaly.model.WindowSnapshot;
import com.iotwatch.anomaly.retry.RetryHandler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SinkDispatcher - fans pipeline output out to the configured sinks.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>anomalous records go to every {@link AnomalySink}</li>
 *   <li>finalized windows go to every {@link AggregateSink}</li>
 *   <li>alerts go to the {@link NotificationChannel}s named by the alert</li>
 * </ul>
 *
 * <h2>Delivery</h2>
 * <p>Each sink has its own {@link SinkLane}. Delivery is at-least-once; an item a sink has
 * acknowledged is not sent to that sink again while its acknowledgment is remembered.
 * Nothing is silently discarded: exhausted retries, backpressure drops and items left over
 * at shutdown all end up in the {@link DeadLetterQueue}.</p>
 */
@Component
@Slf4j
public class SinkDispatcher {

    private static final String LOG_PREFIX = "[DISPATCH]";

    private final List<SinkLane<AnnotatedRecord>> anomalyLanes = new ArrayList<>();
    private final List<SinkLane<WindowSnapshot>> aggregateLanes = new ArrayList<>();
    private final Map<String, SinkLane<AlertEvent>> channelLanes = new LinkedHashMap<>();
    private final Map<String, SinkLane<?>> lanesByName = new LinkedHashMap<>();

    private final DeadLetterQueue deadLetters;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Duration shutdownTimeout;

    @Autowired
    public SinkDispatcher(List<AnomalySink> anomalySinks,
                          List<AggregateSink> aggregateSinks,
                          List<NotificationChannel> channels,
                          RetryHandler retryHandler,
                          DeliveryAckTracker ackTracker,
                          DeadLetterQueue deadLetters,
                          FailureReporter failureReporter,
                          PipelineProperties properties,
                          PipelineMetrics metrics) {
        this(anomalySinks, aggregateSinks, channels, LaneSettings.from(properties.getSinks()),
            properties.getShutdownTimeout(), retryHandler, ackTracker, deadLetters, failureReporter, metrics);
    }

    public SinkDispatcher(List<? extends AnomalySink> anomalySinks,
                          List<? extends AggregateSink> aggregateSinks,
                          List<? extends NotificationChannel> channels,
                          LaneSettings settings,
                          Duration shutdownTimeout,
                          RetryHandler retryHandler,
                          DeliveryAckTracker ackTracker,
                          DeadLetterQueue deadLetters,
                          FailureReporter failureReporter,
                          PipelineMetrics metrics) {
        this.deadLetters = deadLetters;
        this.shutdownTimeout = shutdownTimeout;

        for (AnomalySink sink : anomalySinks) {
            anomalyLanes.add(register(new SinkLane<>(sink, AnnotatedRecord::recordId, settings,
                retryHandler, ackTracker, deadLetters, failureReporter, metrics)));
        }
        for (AggregateSink sink : aggregateSinks) {
            aggregateLanes.add(register(new SinkLane<>(sink, WindowSnapshot::getId, settings,
                retryHandler, ackTracker, deadLetters, failureReporter, metrics)));
        }
        for (NotificationChannel channel : channels) {
            channelLanes.put(channel.name(), register(new SinkLane<>(channel, AlertEvent::getId, settings,
                retryHandler, ackTracker, deadLetters, failureReporter, metrics)));
        }
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        lanesByName.values().forEach(SinkLane::start);
        log.info("{} Started lanes: anomaly={}, aggregate={}, channels={}", LOG_PREFIX,
            names(anomalyLanes), names(aggregateLanes), channelLanes.keySet());
    }

    public void dispatchAnomaly(AnnotatedRecord record) throws InterruptedException {
        for (SinkLane<AnnotatedRecord> lane : anomalyLanes) {
            lane.submit(record);
        }
    }

    public void dispatchWindow(WindowSnapshot window) throws InterruptedException {
        for (SinkLane<WindowSnapshot> lane : aggregateLanes) {
            lane.submit(window);
        }
    }

    public void dispatchAlert(AlertEvent alert) throws InterruptedException {
        for (String channel : alert.getChannels()) {
            SinkLane<AlertEvent> lane = channelLanes.get(channel);
            if (lane == null) {
                log.warn("{} Alert {} names unknown channel '{}', skipped", LOG_PREFIX, alert.getId(), channel);
                continue;
            }
            lane.submit(alert);
        }
    }

    /**
     * Re-queue every dead letter to the lane it came from.
     *
     * @return number of items re-queued; letters of sinks that no longer exist stay dead-lettered
     */
    public int replayDeadLetters() throws InterruptedException {
        List<DeadLetter> letters = deadLetters.drain();
        int replayed = 0;
        for (DeadLetter letter : letters) {
            SinkLane<?> lane = lanesByName.get(letter.getSinkName());
            if (lane == null || stopped.get()) {
                deadLetters.add(letter);
                continue;
            }
            lane.resubmit(letter.getPayload());
            replayed++;
        }
        log.info("{} Replayed {} of {} dead letters", LOG_PREFIX, replayed, letters.size());
        return replayed;
    }

    /**
     * Stop accepting, let every lane empty its queue and finish in-flight writes.
     * Lanes drain concurrently; the timeout bounds the whole call.
     *
     * @return true if every lane drained completely
     */
    public boolean drainAndStop(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) {
            return true;
        }
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        boolean allDrained = true;
        for (SinkLane<?> lane : lanesByName.values()) {
            long remaining = Math.max(1, deadline - System.currentTimeMillis());
            try {
                allDrained &= lane.drainAndStop(Duration.ofMillis(remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} Interrupted while draining lane {}", LOG_PREFIX, lane.name());
                allDrained = false;
            }
        }
        log.info("{} All lanes stopped (drained={}, deadLetters={})", LOG_PREFIX, allDrained, deadLetters.size());
        return allDrained;
    }

    @PreDestroy
    public void stop() {
        drainAndStop(shutdownTimeout);
    }

    public boolean hasChannel(String name) {
        return channelLanes.containsKey(name);
    }

    public int totalQueueDepth() {
        return lanesByName.values().stream().mapToInt(SinkLane::queueDepth).sum();
    }

    public Map<String, Map<String, Object>> laneStats() {
        Map<String, Map<String, Object>> stats = new LinkedHashMap<>();
        lanesByName.forEach((name, lane) -> stats.put(name, lane.stats()));
        return stats;
    }

    private <T> SinkLane<T> register(SinkLane<T> lane) {
        if (lanesByName.putIfAbsent(lane.name(), lane) != null) {
            throw new IllegalStateException("Duplicate sink name: " + lane.name());
        }
        return lane;
    }

    private static List<String> names(List<? extends SinkLane<?>> lanes) {
        List<String> out = new ArrayList<>();
        for (SinkLane<?> lane : lanes) {
            out.add(lane.name());
        }
        return out;
    }
}
