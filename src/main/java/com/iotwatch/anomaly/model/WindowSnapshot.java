package com.iotwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * WindowSnapshot - finalized tumbling window for one device.
 *
 * Emitted exactly once by the aggregator and immutable afterwards. The id is derived
 * from {@code (deviceId, windowStart)} so a repeated delivery overwrites the same
 * document instead of adding a second one.
 */
@Value
@Builder
@Jacksonized
@Document(collection = "telemetry_windows")
@CompoundIndex(name = "device_window_idx", def = "{'deviceId': 1, 'windowStart': -1}")
public class WindowSnapshot {

    @Id
    String id;

    String deviceId;
    String location;
    Instant windowStart;
    Instant windowEnd;
    long count;
    FieldStats temperature;
    FieldStats humidity;

    public static String idFor(String deviceId, Instant windowStart) {
        return deviceId + "@" + windowStart.toEpochMilli();
    }
}
