package com.iotwatch.anomaly.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.iotwatch.anomaly.model.TelemetryRecord;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Numeric telemetry fields a rule predicate can test.
 */
public enum TelemetryField {

    TEMPERATURE("temperature", TelemetryRecord::getTemperature),
    HUMIDITY("humidity", TelemetryRecord::getHumidity);

    private final String key;
    private final ToDoubleFunction<TelemetryRecord> extractor;

    TelemetryField(String key, ToDoubleFunction<TelemetryRecord> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    public double extract(TelemetryRecord record) {
        return extractor.applyAsDouble(record);
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Case-insensitive lookup; returns null for unknown names so validation can report them.
     */
    @JsonCreator
    public static TelemetryField fromKey(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TelemetryField field : values()) {
            if (field.key.equals(normalized)) {
                return field;
            }
        }
        return null;
    }
}
