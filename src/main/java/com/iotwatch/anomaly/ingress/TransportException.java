package com.iotwatch.anomaly.ingress;

import java.io.IOException;

/**
 * Transport-level failure of a telemetry source (broker unreachable, file unreadable).
 * Always treated as transient by the ingress adapter.
 */
public class TransportException extends IOException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
