package com.iotwatch.anomaly.config;

import java.time.Duration;

/**
 * Central constants for telemetry processing.
 *
 * Defaults only: every value that matters at runtime can be overridden
 * through {@link PipelineProperties}.
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== WINDOW CONSTANTS ==========

    public static final Duration DEFAULT_WINDOW_SIZE = Duration.ofMinutes(1);
    public static final Duration WINDOW_GRACE_PERIOD = Duration.ofSeconds(10);

    // ========== INGRESS CONSTANTS ==========

    public static final int MAX_POLL_RECORDS = 500;
    public static final String UNKNOWN_LOCATION = "unknown";

    // ========== PERFORMANCE CONSTANTS ==========

    public static final int THREAD_POOL_SIZE = 4;
    public static final int QUEUE_CAPACITY = 1000;
    public static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    // ========== RETRY CONSTANTS ==========

    public static final int MAX_RETRY_ATTEMPTS = 3;
    public static final long INITIAL_RETRY_DELAY_MS = 100;
    public static final double RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final long MAX_RETRY_DELAY_MS = 10000;

    // ========== TIMEOUT CONSTANTS ==========

    public static final Duration NETWORK_TIMEOUT = Duration.ofSeconds(10);

    // ========== MONITORING CONSTANTS ==========

    public static final int STATS_LOG_INTERVAL_SECONDS = 60;
}
