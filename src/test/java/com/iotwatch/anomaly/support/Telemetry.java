package com.iotwatch.anomaly.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.retry.RetryPolicy;

import java.time.Duration;
import java.time.Instant;

/**
 * Shared builders for test records and fast retry settings.
 */
public final class Telemetry {

    public static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private Telemetry() {
    }

    public static TelemetryRecord record(String deviceId, long secondsAfterT0, double temperature, double humidity) {
        return TelemetryRecord.builder()
            .deviceId(deviceId)
            .timestamp(T0.plusSeconds(secondsAfterT0))
            .temperature(temperature)
            .humidity(humidity)
            .location("lab-1")
            .build();
    }

    public static TelemetryRecord record(String deviceId, long secondsAfterT0, double temperature) {
        return record(deviceId, secondsAfterT0, temperature, 40.0);
    }

    public static String json(String deviceId, long secondsAfterT0, double temperature, double humidity) {
        return String.format("{\"deviceId\":\"%s\",\"timestamp\":\"%s\",\"temperature\":%s,\"humidity\":%s,"
                + "\"location\":\"lab-1\"}",
            deviceId, T0.plusSeconds(secondsAfterT0), temperature, humidity);
    }

    public static RetryPolicy fastRetry(int maxAttempts) {
        return RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .initialDelay(Duration.ofMillis(1))
            .multiplier(1.0)
            .maxDelay(Duration.ofMillis(5))
            .build();
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
