package com.iotwatch.anomaly.dispatch.sink;

import com.iotwatch.anomaly.dispatch.AggregateSink;
import com.iotwatch.anomaly.model.WindowSnapshot;
import com.iotwatch.anomaly.repository.WindowSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores finalized windows in MongoDB.
 *
 * {@code save} upserts by the window id, so delivering the same window twice leaves
 * exactly one document.
 */
@Component
@Slf4j
public class MongoWindowSink implements AggregateSink {

    public static final String NAME = "mongo-windows";

    private final WindowSnapshotRepository repository;

    public MongoWindowSink(WindowSnapshotRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(WindowSnapshot window) {
        repository.save(window);
        log.debug("[SINK:{}] Saved window {} (count={})", NAME, window.getId(), window.getCount());
    }
}
