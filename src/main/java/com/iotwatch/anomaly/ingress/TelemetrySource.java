package com.iotwatch.anomaly.ingress;

import java.time.Duration;
import java.util.List;

/**
 * Pull-based connection to an external telemetry transport.
 *
 * <p>Implementations are used from a single ingress thread and need not be thread-safe.
 * After a {@link TransportException} the adapter closes the source and calls
 * {@link #connect(IngressCursor)} again with the last delivered position.</p>
 */
public interface TelemetrySource extends AutoCloseable {

    /**
     * Open the connection and position it at {@code from}. Partitions absent from the
     * cursor start at the transport's own resume point.
     */
    void connect(IngressCursor from) throws TransportException;

    /**
     * Next batch of entries, possibly empty when nothing arrived within {@code timeout}.
     */
    List<SourceEntry> poll(Duration timeout) throws TransportException;

    /**
     * Persist {@code position} as the resume point for a later {@link #connect}. Optional.
     */
    default void commit(IngressCursor position) throws TransportException {
    }

    /**
     * Human-readable connection descriptor for logs.
     */
    String describe();

    @Override
    void close();
}
