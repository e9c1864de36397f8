package com.iotwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Operator-visible failure notice.
 */
@Value
@Builder
@Jacksonized
public class OperatorFailure {

    public enum Category {
        INGRESS_TERMINAL,
        SINK_DELIVERY_EXHAUSTED,
        CONFIGURATION_REJECTED
    }

    Category category;
    String component;
    String message;
    Instant occurredAt;
}
