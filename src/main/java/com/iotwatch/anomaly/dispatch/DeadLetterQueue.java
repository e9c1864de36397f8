package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.DeadLetter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded store of items no sink could take. When full, the oldest entry is evicted and counted.
 */
@Component
@Slf4j
public class DeadLetterQueue {

    private final int capacity;
    private final PipelineMetrics metrics;
    private final Deque<DeadLetter> entries = new ArrayDeque<>();

    @Autowired
    public DeadLetterQueue(PipelineProperties properties, PipelineMetrics metrics) {
        this(properties.getSinks().getDeadLetterCapacity(), metrics);
    }

    public DeadLetterQueue(int capacity, PipelineMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Dead-letter capacity must be positive");
        }
        this.capacity = capacity;
        this.metrics = metrics;
    }

    public synchronized void add(DeadLetter letter) {
        if (entries.size() >= capacity) {
            DeadLetter evicted = entries.removeFirst();
            metrics.incDeadLetterEviction();
            log.warn("[DLQ] Full ({}), evicted oldest entry sink={} item={}",
                capacity, evicted.getSinkName(), evicted.getItemId());
        }
        entries.addLast(letter);
    }

    /**
     * Oldest first.
     */
    public synchronized List<DeadLetter> list() {
        return new ArrayList<>(entries);
    }

    /**
     * Remove and return every entry, oldest first.
     */
    public synchronized List<DeadLetter> drain() {
        List<DeadLetter> out = new ArrayList<>(entries);
        entries.clear();
        return out;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
