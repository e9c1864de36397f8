package com.iotwatch.anomaly.ingress;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.retry.RetryHandler;
import com.iotwatch.anomaly.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Event ingress adapter: turns the configured {@link TelemetrySource} into
 * {@link TelemetryStream}s that can be (re)started from any {@link IngressCursor}.
 */
@Component
@Slf4j
public class IngressAdapter {

    private final TelemetrySource source;
    private final TelemetryParser parser;
    private final RetryHandler retryHandler;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    @Autowired
    public IngressAdapter(TelemetrySource source, TelemetryParser parser, RetryHandler retryHandler,
                          PipelineProperties properties, PipelineMetrics metrics) {
        this(source, parser, retryHandler, RetryPolicy.from(properties.getIngress().getRetry()), metrics);
    }

    public IngressAdapter(TelemetrySource source, TelemetryParser parser, RetryHandler retryHandler,
                          RetryPolicy retryPolicy, PipelineMetrics metrics) {
        this.source = source;
        this.parser = parser;
        this.retryHandler = retryHandler;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    /**
     * Open a stream positioned at {@code from}. The connection is made lazily on first poll.
     */
    public TelemetryStream open(IngressCursor from) {
        log.info("[INGRESS] Opening stream over {} from {}", source.describe(), from);
        return new TelemetryStream(source, from, parser, retryHandler, retryPolicy, metrics);
    }

    public String describeSource() {
        return source.describe();
    }
}
