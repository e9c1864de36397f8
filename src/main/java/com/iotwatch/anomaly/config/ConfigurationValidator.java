package com.iotwatch.anomaly.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup on an inconsistent pipeline configuration, before the pipeline starts.
 */
@Component
@Slf4j
public class ConfigurationValidator {

    private final PipelineProperties properties;

    public ConfigurationValidator(PipelineProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void validateConfiguration() {
        log.info("[CONFIG] Validating pipeline configuration...");
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed: " + errors);
        }
        log.info("[CONFIG] Configuration validation passed");
        logConfigurationSummary();
    }

    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        PipelineProperties.Ingress ingress = properties.getIngress();
        if (!"kafka".equalsIgnoreCase(ingress.getType()) && !"file".equalsIgnoreCase(ingress.getType())) {
            errors.add("pipeline.ingress.type must be kafka or file, was " + ingress.getType());
        }
        if ("kafka".equalsIgnoreCase(ingress.getType()) && isNullOrEmpty(ingress.getTopic())) {
            errors.add("pipeline.ingress.topic is not configured");
        }
        if ("file".equalsIgnoreCase(ingress.getType()) && isNullOrEmpty(ingress.getFile())) {
            errors.add("pipeline.ingress.file is not configured");
        }
        requirePositive(errors, "pipeline.ingress.max-poll-records", ingress.getMaxPollRecords());
        requirePositive(errors, "pipeline.ingress.poll-timeout", ingress.getPollTimeout());
        validateRetry(errors, "pipeline.ingress.retry", ingress.getRetry());

        PipelineProperties.Window window = properties.getWindow();
        requirePositive(errors, "pipeline.window.size", window.getSize());
        if (window.getGrace() == null || window.getGrace().isNegative()) {
            errors.add("pipeline.window.grace must not be negative");
        }
        requirePositive(errors, "pipeline.window.idle-timeout", window.getIdleTimeout());
        requirePositive(errors, "pipeline.window.idle-check-interval", window.getIdleCheckInterval());

        PipelineProperties.Partitions partitions = properties.getPartitions();
        requirePositive(errors, "pipeline.partitions.count", partitions.getCount());
        requirePositive(errors, "pipeline.partitions.queue-capacity", partitions.getQueueCapacity());

        PipelineProperties.Sinks sinks = properties.getSinks();
        requirePositive(errors, "pipeline.sinks.queue-capacity", sinks.getQueueCapacity());
        requirePositive(errors, "pipeline.sinks.call-timeout", sinks.getCallTimeout());
        requirePositive(errors, "pipeline.sinks.call-concurrency", sinks.getCallConcurrency());
        requirePositive(errors, "pipeline.sinks.dead-letter-capacity", sinks.getDeadLetterCapacity());
        requirePositive(errors, "pipeline.sinks.ack-cache-size", sinks.getAckCacheSize());
        validateRetry(errors, "pipeline.sinks.retry", sinks.getRetry());

        if (isNullOrEmpty(properties.getRules().getLocation())) {
            errors.add("pipeline.rules.location is not configured");
        }
        return errors;
    }

    private void validateRetry(List<String> errors, String prefix, PipelineProperties.Retry retry) {
        requirePositive(errors, prefix + ".max-attempts", retry.getMaxAttempts());
        if (retry.getMultiplier() < 1.0) {
            errors.add(prefix + ".multiplier must be at least 1.0");
        }
        if (retry.getInitialDelay() == null || retry.getInitialDelay().isNegative()) {
            errors.add(prefix + ".initial-delay must not be negative");
        }
    }

    private void requirePositive(List<String> errors, String name, long value) {
        if (value <= 0) {
            errors.add(name + " must be positive, was " + value);
        }
    }

    private void requirePositive(List<String> errors, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(name + " must be a positive duration, was " + value);
        }
    }

    private void logConfigurationSummary() {
        log.info("[CONFIG] Configuration Summary:");
        log.info("  Ingress: type={}, topic={}, file={}", properties.getIngress().getType(),
            properties.getIngress().getTopic(), properties.getIngress().getFile());
        log.info("  Window: size={}, grace={}, idleTimeout={}", properties.getWindow().getSize(),
            properties.getWindow().getGrace(), properties.getWindow().getIdleTimeout());
        log.info("  Partitions: count={}, queueCapacity={}", properties.getPartitions().getCount(),
            properties.getPartitions().getQueueCapacity());
        log.info("  Sinks: queueCapacity={}, callTimeout={}, deadLetterCapacity={}",
            properties.getSinks().getQueueCapacity(), properties.getSinks().getCallTimeout(),
            properties.getSinks().getDeadLetterCapacity());
        log.info("  Rules: {}", properties.getRules().getLocation());
    }

    private boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }
}
