package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.DeadLetter;
import com.iotwatch.anomaly.model.OperatorFailure;
import com.iotwatch.anomaly.retry.RetryExhaustedException;
import com.iotwatch.anomaly.retry.RetryHandler;
import com.iotwatch.anomaly.retry.RetryPolicy;
import com.iotwatch.anomaly.util.BoundedStageQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * SinkLane - isolated delivery path to one sink.
 *
 * <ul>
 *   <li>bounded queue; items pushed out by backpressure are dead-lettered</li>
 *   <li>one worker thread taking items in order</li>
 *   <li>a small bounded call pool, so each external call can be abandoned after the call timeout</li>
 *   <li>retry with exponential backoff, then dead-letter and operator report</li>
 * </ul>
 *
 * A sink that hangs only ever stalls its own lane.
 *
 * @param <T> item type
 */
@Slf4j
public class SinkLane<T> {

    private final DeliveryTarget<T> target;
    private final Function<T, String> idOf;
    private final BoundedStageQueue<T> queue;
    private final ThreadPoolTaskExecutor callPool;
    private final long callTimeoutMs;
    private final RetryHandler retryHandler;
    private final RetryPolicy retryPolicy;
    private final DeliveryAckTracker ackTracker;
    private final DeadLetterQueue deadLetters;
    private final FailureReporter failureReporter;
    private final PipelineMetrics metrics;
    private final String logPrefix;

    private final Thread worker;
    private volatile boolean accepting = true;
    private volatile boolean running = true;

    SinkLane(DeliveryTarget<T> target, Function<T, String> idOf, LaneSettings settings,
             RetryHandler retryHandler, DeliveryAckTracker ackTracker, DeadLetterQueue deadLetters,
             FailureReporter failureReporter, PipelineMetrics metrics) {
        this.target = target;
        this.idOf = idOf;
        this.retryHandler = retryHandler;
        this.retryPolicy = settings.getRetryPolicy();
        this.ackTracker = ackTracker;
        this.deadLetters = deadLetters;
        this.failureReporter = failureReporter;
        this.metrics = metrics;
        this.callTimeoutMs = settings.getCallTimeout().toMillis();
        this.logPrefix = "[SINK:" + target.name() + "]";
        this.queue = new BoundedStageQueue<>("sink:" + target.name(), settings.getQueueCapacity(),
            settings.getOfferTimeout(), metrics,
            dropped -> deadLetter(dropped, DeadLetter.Reason.BACKPRESSURE, "dropped from full sink queue", 0));

        this.callPool = new ThreadPoolTaskExecutor();
        callPool.setCorePoolSize(settings.getCallConcurrency());
        callPool.setMaxPoolSize(settings.getCallConcurrency());
        // once abandoned calls hold every slot and the hand-off queue, new calls are rejected
        // and counted as failed attempts
        callPool.setQueueCapacity(settings.getCallConcurrency());
        callPool.setThreadNamePrefix("sink-" + target.name() + "-call-");
        callPool.setDaemon(true);
        callPool.setWaitForTasksToCompleteOnShutdown(false);
        callPool.initialize();

        this.worker = new Thread(this::runLoop, "sink-" + target.name());
        worker.setDaemon(true);
    }

    void start() {
        worker.start();
        log.info("{} Lane started (queue={}, callTimeout={}ms, retries={})",
            logPrefix, queue.capacity(), callTimeoutMs, retryPolicy.getMaxAttempts());
    }

    public String name() {
        return target.name();
    }

    /**
     * Queue an item for delivery. Blocks up to the offer timeout when the lane is full.
     */
    public void submit(T item) throws InterruptedException {
        if (!accepting) {
            deadLetter(item, DeadLetter.Reason.SHUTDOWN, "lane no longer accepting items", 0);
            return;
        }
        queue.put(item);
    }

    @SuppressWarnings("unchecked")
    void resubmit(Object payload) throws InterruptedException {
        submit((T) payload);
    }

    /**
     * Stop accepting, let the worker empty the queue, and wait up to {@code timeout}.
     * Whatever is still queued afterwards is dead-lettered.
     *
     * @return true if the lane drained completely
     */
    boolean drainAndStop(Duration timeout) throws InterruptedException {
        accepting = false;
        running = false;
        worker.join(Math.max(1, timeout.toMillis()));
        boolean drained = !worker.isAlive();
        if (!drained) {
            log.warn("{} Drain timed out with {} items queued", logPrefix, queue.size());
            worker.interrupt();
            worker.join(callTimeoutMs);
        }
        T leftover;
        while ((leftover = queue.poll(Duration.ZERO)) != null) {
            deadLetter(leftover, DeadLetter.Reason.SHUTDOWN, "undelivered at shutdown", 0);
        }
        callPool.shutdown();
        log.info("{} Lane stopped (drained={})", logPrefix, drained);
        return drained;
    }

    public int queueDepth() {
        return queue.size();
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("queueDepth", queue.size());
        stats.put("queueCapacity", queue.capacity());
        stats.put("backpressureDrops", queue.dropped());
        stats.put("activeCalls", callPool.getActiveCount());
        return stats;
    }

    private void runLoop() {
        while (running || !queue.isEmpty()) {
            T item;
            try {
                item = queue.poll(Duration.ofMillis(100));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item != null) {
                processGuarded(item);
            }
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
        }
    }

    private void processGuarded(T item) {
        try {
            process(item);
        } catch (RuntimeException e) {
            log.error("{} Unexpected failure handling item: {}", logPrefix, e.getMessage(), e);
            deadLetter(item, DeadLetter.Reason.UNDELIVERABLE, e.getClass().getSimpleName() + ": " + e.getMessage(), 0);
        }
    }

    void process(T item) {
        String itemId = itemIdOf(item);
        if (ackTracker.isAcknowledged(target.name(), itemId)) {
            metrics.incDuplicateSkipped();
            log.debug("{} Skipping already acknowledged item {}", logPrefix, itemId);
            return;
        }
        try {
            retryHandler.executeWithRetry(() -> attemptOnce(item, itemId),
                "sink:" + target.name() + ":" + itemId, retryPolicy);
            ackTracker.acknowledge(target.name(), itemId);
            metrics.incDelivered(target.name());
        } catch (RetryExhaustedException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            deadLetter(item, DeadLetter.Reason.RETRIES_EXHAUSTED, cause.getMessage(), e.getAttempts());
            failureReporter.report(OperatorFailure.Category.SINK_DELIVERY_EXHAUSTED, "sink:" + target.name(),
                "Item " + itemId + " dead-lettered after " + e.getAttempts() + " attempts: " + cause.getMessage());
        }
    }

    private void attemptOnce(T item, String itemId) {
        Future<Object> call;
        try {
            call = callPool.submit(() -> {
                target.deliver(item);
                return null;
            });
        } catch (TaskRejectedException e) {
            throw new SinkDeliveryException("All " + callPool.getMaxPoolSize() + " call slots busy", e);
        }
        try {
            call.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new SinkDeliveryException("Call timed out after " + callTimeoutMs + "ms for item " + itemId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SinkDeliveryException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new SinkDeliveryException("Interrupted while delivering " + itemId, e);
        }
    }

    private String itemIdOf(T item) {
        try {
            return idOf.apply(item);
        } catch (RuntimeException e) {
            log.warn("{} Item has no usable id: {}", logPrefix, e.getMessage());
            return "unidentified-" + Integer.toHexString(System.identityHashCode(item));
        }
    }

    private void deadLetter(T item, DeadLetter.Reason reason, String error, int attempts) {
        String itemId = itemIdOf(item);
        deadLetters.add(DeadLetter.builder()
            .sinkName(target.name())
            .itemId(itemId)
            .payload(item)
            .reason(reason)
            .error(error)
            .attempts(attempts)
            .failedAt(Instant.now())
            .build());
        metrics.incDeadLettered(target.name());
        log.warn("{} Dead-lettered item {} ({}): {}", logPrefix, itemId, reason, error);
    }
}
