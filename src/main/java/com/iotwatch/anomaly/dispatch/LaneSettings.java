package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.retry.RetryPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-lane queue, timeout and retry settings.
 */
@Value
@Builder
public class LaneSettings {

    int queueCapacity;
    Duration offerTimeout;
    Duration callTimeout;
    int callConcurrency;
    RetryPolicy retryPolicy;

    public static LaneSettings from(PipelineProperties.Sinks sinks) {
        return LaneSettings.builder()
            .queueCapacity(sinks.getQueueCapacity())
            .offerTimeout(sinks.getOfferTimeout())
            .callTimeout(sinks.getCallTimeout())
            .callConcurrency(Math.max(1, sinks.getCallConcurrency()))
            .retryPolicy(RetryPolicy.from(sinks.getRetry()))
            .build();
    }
}
