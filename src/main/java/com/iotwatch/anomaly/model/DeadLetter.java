package com.iotwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An item a sink could not take, kept for inspection or replay.
 */
@Value
@Builder
public class DeadLetter {

    public enum Reason {
        /** Every delivery attempt failed. */
        RETRIES_EXHAUSTED,
        /** Evicted from a full sink queue. */
        BACKPRESSURE,
        /** Still queued when the shutdown drain timed out. */
        SHUTDOWN,
        /** Could not be handed to the sink at all, e.g. no id could be derived. */
        UNDELIVERABLE
    }

    String sinkName;
    String itemId;
    Object payload;
    Reason reason;
    String error;
    int attempts;
    Instant failedAt;
}
