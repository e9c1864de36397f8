package com.iotwatch.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Externalized settings for the anomaly pipeline.
 *
 * Window size, grace period and idle timeout are static: they are read once at startup.
 * Alert rules are NOT configured here, see {@code pipeline.rules.location}.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    /**
     * Master switch. When false the pipeline bean is created but never started.
     */
    private boolean enabled = true;

    private Ingress ingress = new Ingress();

    private Window window = new Window();

    private Partitions partitions = new Partitions();

    private Sinks sinks = new Sinks();

    private Rules rules = new Rules();

    private Failures failures = new Failures();

    /**
     * Maximum time the shutdown sequence waits for each stage to drain.
     */
    private Duration shutdownTimeout = ProcessingConstants.SHUTDOWN_TIMEOUT;

    @Data
    public static class Ingress {
        /**
         * Transport type: "kafka" or "file".
         */
        private String type = "kafka";

        /**
         * Kafka topic carrying raw telemetry.
         */
        private String topic = "device-telemetry";

        /**
         * Consumer group used for committed resumption offsets.
         */
        private String consumerGroup = "anomaly-stream";

        /**
         * Where to start when neither a cursor nor a committed offset exists: earliest | latest.
         */
        private String autoOffsetReset = "earliest";

        /**
         * JSON-lines replay file for the "file" transport.
         */
        private String file = "telemetry.jsonl";

        /**
         * Maximum entries returned by a single poll.
         */
        private int maxPollRecords = ProcessingConstants.MAX_POLL_RECORDS;

        private Duration pollTimeout = Duration.ofMillis(200);

        private Retry retry = new Retry();
    }

    @Data
    public static class Window {
        /**
         * Tumbling window length.
         */
        private Duration size = ProcessingConstants.DEFAULT_WINDOW_SIZE;

        /**
         * Allowed lateness behind the per-device watermark.
         */
        private Duration grace = ProcessingConstants.WINDOW_GRACE_PERIOD;

        /**
         * Wall-clock silence after which a device's open windows are flushed.
         */
        private Duration idleTimeout = Duration.ofSeconds(30);

        /**
         * How often partitions are asked to check for idle devices.
         */
        private Duration idleCheckInterval = Duration.ofSeconds(1);

        /**
         * Wall-clock silence after which a device's watermark is forgotten.
         */
        private Duration stateRetention = Duration.ofHours(1);
    }

    @Data
    public static class Partitions {
        /**
         * Number of key-owning workers. All records of a device go to the same worker.
         */
        private int count = ProcessingConstants.THREAD_POOL_SIZE;

        private int queueCapacity = ProcessingConstants.QUEUE_CAPACITY;

        /**
         * How long a producer blocks on a full queue before the oldest item is dropped.
         */
        private Duration offerTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class Sinks {
        private int queueCapacity = ProcessingConstants.QUEUE_CAPACITY;

        private Duration offerTimeout = Duration.ofMillis(500);

        /**
         * Upper bound for a single external sink call.
         */
        private Duration callTimeout = ProcessingConstants.NETWORK_TIMEOUT;

        /**
         * Concurrent calls allowed per sink. Calls beyond this are rejected and retried.
         */
        private int callConcurrency = 2;

        private Retry retry = new Retry();

        private int deadLetterCapacity = 10_000;

        private int ackCacheSize = 100_000;

        private Duration ackRetention = Duration.ofHours(1);

        /**
         * Kafka topic for the "kafka" notification channel.
         */
        private String alertTopic = "telemetry-alerts";

        /**
         * Registers the "kafka" notification channel.
         */
        private boolean kafkaAlertsEnabled = true;

        /**
         * Registers the Redis window cache as an additional aggregate sink.
         */
        private boolean redisEnabled = false;

        /**
         * TTL of window snapshots in the Redis hot cache.
         */
        private Duration redisWindowTtl = Duration.ofHours(6);
    }

    @Data
    public static class Rules {
        /**
         * Spring resource location of the JSON rule file.
         */
        private String location = "classpath:rules.json";
    }

    @Data
    public static class Failures {
        /**
         * Optional Kafka topic receiving operator failures. Blank disables publishing.
         */
        private String topic = "";

        /**
         * Number of recent failures kept for the operations API.
         */
        private int historySize = 200;
    }

    @Data
    public static class Retry {
        private int maxAttempts = ProcessingConstants.MAX_RETRY_ATTEMPTS;

        private Duration initialDelay = Duration.ofMillis(ProcessingConstants.INITIAL_RETRY_DELAY_MS);

        private double multiplier = ProcessingConstants.RETRY_BACKOFF_MULTIPLIER;

        private Duration maxDelay = Duration.ofMillis(ProcessingConstants.MAX_RETRY_DELAY_MS);
    }
}
