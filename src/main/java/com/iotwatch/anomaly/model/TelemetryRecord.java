package com.iotwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * A single normalized telemetry reading.
 *
 * Produced by the ingress parser and never mutated afterwards. Per device,
 * timestamps are expected to be non-decreasing in delivery order; anything else
 * is the window aggregator's late-data case.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TelemetryRecord {

    String deviceId;
    Instant timestamp;
    double temperature;
    double humidity;
    String location;

    /**
     * Identity used for sink acknowledgments: a name-based UUID over every field.
     * Two readings of one device at the same instant differ unless their values are equal.
     */
    public String recordId() {
        String name = deviceId + "|" + timestamp + "|" + temperature + "|" + humidity + "|" + location;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
