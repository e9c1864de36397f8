package com.iotwatch.anomaly.ingress;

import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.retry.RetryExhaustedException;
import com.iotwatch.anomaly.retry.RetryHandler;
import com.iotwatch.anomaly.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Lazy, pull-driven sequence of telemetry records over one {@link TelemetrySource}.
 *
 * <p>Nothing is read until {@link #poll(Duration)} is called. {@link #position()} is the
 * cursor just past the last entry handed out (parsed or dropped), so a new stream opened
 * at that position continues without gaps.</p>
 *
 * <p>A transport failure closes the source and reconnects at {@link #position()} with
 * exponential backoff. When the retry budget is spent the stream throws
 * {@link IngressFailureException}.</p>
 */
@Slf4j
public class TelemetryStream implements AutoCloseable {

    private static final String LOG_PREFIX = "[INGRESS]";

    private final TelemetrySource source;
    private final TelemetryParser parser;
    private final RetryHandler retryHandler;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;

    private volatile IngressCursor position;
    private boolean connected;
    private boolean closed;

    TelemetryStream(TelemetrySource source, IngressCursor from, TelemetryParser parser,
                    RetryHandler retryHandler, RetryPolicy retryPolicy, PipelineMetrics metrics) {
        this.source = source;
        this.position = from;
        this.parser = parser;
        this.retryHandler = retryHandler;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    /**
     * Next batch of well-formed records; empty when nothing (valid) arrived in time.
     *
     * @throws IngressFailureException when the transport stays down after all retries
     */
    public synchronized List<TelemetryRecord> poll(Duration timeout) {
        if (closed) {
            throw new IllegalStateException("Stream over " + source.describe() + " is closed");
        }
        List<SourceEntry> entries;
        try {
            entries = retryHandler.executeWithRetry(() -> pollOnce(timeout),
                "ingress-poll " + source.describe(), retryPolicy);
        } catch (RetryExhaustedException e) {
            throw new IngressFailureException("Telemetry source " + source.describe()
                + " unavailable after " + e.getAttempts() + " attempts", position, e.getCause());
        }

        List<TelemetryRecord> records = new ArrayList<>(entries.size());
        for (SourceEntry entry : entries) {
            position = position.advance(entry);
            parser.parse(entry.getPayload()).ifPresent(record -> {
                metrics.incRecordsIngested();
                records.add(record);
            });
        }
        return records;
    }

    public IngressCursor position() {
        return position;
    }

    /**
     * Store the current position at the transport, if it supports that.
     */
    public synchronized void commit() {
        if (!connected) {
            return;
        }
        try {
            source.commit(position);
        } catch (TransportException e) {
            log.warn("{} Could not commit {} to {}: {}", LOG_PREFIX, position, source.describe(), e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        source.close();
        connected = false;
        log.info("{} Closed {} at {}", LOG_PREFIX, source.describe(), position);
    }

    private List<SourceEntry> pollOnce(Duration timeout) {
        try {
            if (!connected) {
                source.connect(position);
                connected = true;
            }
            return source.poll(timeout);
        } catch (TransportException e) {
            if (connected) {
                metrics.incTransportReconnect();
                source.close();
                connected = false;
            }
            throw new UncheckedIOException(e);
        }
    }
}
