package com.iotwatch.anomaly.util;

import com.iotwatch.anomaly.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded hand-off between two pipeline stages.
 *
 * A producer facing a full queue waits up to {@code offerTimeout}; after that the
 * oldest buffered item is dropped (counted, and handed to the drop callback) to
 * make room. The queue never grows past its capacity.
 *
 * @param <T> item type
 */
@Slf4j
public class BoundedStageQueue<T> {

    private final String name;
    private final ArrayBlockingQueue<T> queue;
    private final long offerTimeoutMs;
    private final PipelineMetrics metrics;
    private final Consumer<T> onDrop;
    private final AtomicLong dropped = new AtomicLong(0);

    public BoundedStageQueue(String name, int capacity, Duration offerTimeout, PipelineMetrics metrics) {
        this(name, capacity, offerTimeout, metrics, item -> { });
    }

    public BoundedStageQueue(String name, int capacity, Duration offerTimeout, PipelineMetrics metrics,
                             Consumer<T> onDrop) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + name);
        }
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.offerTimeoutMs = offerTimeout.toMillis();
        this.metrics = metrics;
        this.onDrop = onDrop;
    }

    /**
     * Enqueue, dropping the oldest item if the queue stays full for the offer timeout.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void put(T item) throws InterruptedException {
        if (queue.offer(item, offerTimeoutMs, TimeUnit.MILLISECONDS)) {
            return;
        }
        while (!queue.offer(item)) {
            T evicted = queue.poll();
            if (evicted != null) {
                dropped.incrementAndGet();
                metrics.incBackpressureDrop(name);
                log.warn("[BACKPRESSURE] Queue '{}' full (capacity {}), dropped oldest item", name, capacity());
                onDrop.accept(evicted);
            }
        }
    }

    /**
     * Enqueue only if there is room right now; never waits and never drops.
     */
    public boolean offerNow(T item) {
        return queue.offer(item);
    }

    /**
     * @return next item, or null when none arrived within the timeout
     */
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return queue.size() + queue.remainingCapacity();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public long dropped() {
        return dropped.get();
    }
}
