package com.iotwatch.anomaly.dispatch.sink;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.dispatch.AggregateSink;
import com.iotwatch.anomaly.model.WindowSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Hot cache of recent windows for dashboards: {@code window:<deviceId>@<start>} with a TTL,
 * plus {@code window:latest:<deviceId>} pointing at the newest one.
 */
@Component
@ConditionalOnProperty(name = "pipeline.sinks.redis-enabled", havingValue = "true")
@Slf4j
public class RedisWindowCacheSink implements AggregateSink {

    public static final String NAME = "redis-window-cache";
    private static final String KEY_PREFIX = "window:";

    private final RedisTemplate<String, WindowSnapshot> redisTemplate;
    private final Duration ttl;

    public RedisWindowCacheSink(RedisTemplate<String, WindowSnapshot> redisTemplate, PipelineProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getSinks().getRedisWindowTtl();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(WindowSnapshot window) {
        redisTemplate.opsForValue().set(KEY_PREFIX + window.getId(), window, ttl);
        redisTemplate.opsForValue().set(KEY_PREFIX + "latest:" + window.getDeviceId(), window, ttl);
        log.debug("[SINK:{}] Cached window {}", NAME, window.getId());
    }
}
