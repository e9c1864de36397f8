package com.iotwatch.anomaly.retry;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.config.ProcessingConstants;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt n waits {@code initialDelay * multiplier^(n-1)},
 * capped at {@code maxDelay}.
 */
@Value
@Builder
public class RetryPolicy {

    int maxAttempts;
    Duration initialDelay;
    double multiplier;
    Duration maxDelay;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder()
            .maxAttempts(ProcessingConstants.MAX_RETRY_ATTEMPTS)
            .initialDelay(Duration.ofMillis(ProcessingConstants.INITIAL_RETRY_DELAY_MS))
            .multiplier(ProcessingConstants.RETRY_BACKOFF_MULTIPLIER)
            .maxDelay(Duration.ofMillis(ProcessingConstants.MAX_RETRY_DELAY_MS))
            .build();
    }

    public static RetryPolicy from(PipelineProperties.Retry retry) {
        return RetryPolicy.builder()
            .maxAttempts(retry.getMaxAttempts())
            .initialDelay(retry.getInitialDelay())
            .multiplier(retry.getMultiplier())
            .maxDelay(retry.getMaxDelay())
            .build();
    }

    /**
     * Delay before the retry that follows failed attempt number {@code attempt} (1-based).
     */
    public long backoffMillis(int attempt) {
        long delay = (long) (initialDelay.toMillis() * Math.pow(multiplier, attempt - 1));
        return Math.min(delay, maxDelay.toMillis());
    }
}
