package com.iotwatch.anomaly.dispatch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.iotwatch.anomaly.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Remembers which (sink, item) pairs a sink has already acknowledged.
 *
 * Bounded by size and age; an entry that expired only means an already-delivered item
 * may be delivered once more, which the sinks tolerate.
 */
@Component
public class DeliveryAckTracker {

    private final Cache<String, Boolean> acknowledged;

    @Autowired
    public DeliveryAckTracker(PipelineProperties properties) {
        this(properties.getSinks().getAckCacheSize(), properties.getSinks().getAckRetention());
    }

    public DeliveryAckTracker(long maximumSize, Duration retention) {
        this.acknowledged = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(retention)
            .build();
    }

    public boolean isAcknowledged(String sinkName, String itemId) {
        return acknowledged.getIfPresent(key(sinkName, itemId)) != null;
    }

    public void acknowledge(String sinkName, String itemId) {
        acknowledged.put(key(sinkName, itemId), Boolean.TRUE);
    }

    public long estimatedSize() {
        return acknowledged.estimatedSize();
    }

    private static String key(String sinkName, String itemId) {
        return sinkName + "|" + itemId;
    }
}
