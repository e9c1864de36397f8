package com.iotwatch.anomaly.dispatch;

/**
 * A single delivery attempt failed: the sink threw, timed out or rejected the call.
 */
public class SinkDeliveryException extends RuntimeException {

    public SinkDeliveryException(String message) {
        super(message);
    }

    public SinkDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
