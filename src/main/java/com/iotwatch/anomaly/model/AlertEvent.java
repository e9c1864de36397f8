package com.iotwatch.anomaly.model;

import com.iotwatch.anomaly.rule.TelemetryField;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Alert emitted when a rule fires for a device.
 *
 * The id is a name-based UUID over rule, device and event time: replaying the same
 * input yields the same id, which is what channels deduplicate on.
 */
@Value
@Builder
@Jacksonized
public class AlertEvent {

    String id;
    String ruleId;
    String deviceId;
    TelemetryField field;
    double triggerValue;
    double threshold;
    Instant timestamp;
    List<String> channels;

    public static String idFor(String ruleId, String deviceId, Instant timestamp) {
        String name = ruleId + "|" + deviceId + "|" + timestamp.toEpochMilli();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
