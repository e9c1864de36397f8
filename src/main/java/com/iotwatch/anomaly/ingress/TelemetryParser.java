package com.iotwatch.anomaly.ingress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotwatch.anomaly.config.ProcessingConstants;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.TelemetryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Normalizes raw telemetry JSON into {@link TelemetryRecord}.
 *
 * <p>Expected shape: {@code {"deviceId", "timestamp", "temperature", "humidity", "location"}}.
 * The timestamp may be an ISO-8601 string or epoch milliseconds; numeric fields may be
 * JSON numbers or numeric strings. {@code location} is optional.</p>
 *
 * <p>Malformed entries are dropped and counted by reason. Nothing here throws.</p>
 */
@Component
@Slf4j
public class TelemetryParser {

    private static final String LOG_PREFIX = "[INGRESS-PARSE]";
    private static final Instant MIN_TIMESTAMP = Instant.ofEpochMilli(Long.MIN_VALUE);
    private static final Instant MAX_TIMESTAMP = Instant.ofEpochMilli(Long.MAX_VALUE);

    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;

    public TelemetryParser(ObjectMapper objectMapper, PipelineMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public Optional<TelemetryRecord> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return reject("empty_payload", payload);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return reject("unparseable_json", payload);
        }
        if (node == null || !node.isObject()) {
            return reject("not_an_object", payload);
        }

        JsonNode deviceNode = node.get("deviceId");
        if (deviceNode == null || !deviceNode.isTextual() || deviceNode.asText().isBlank()) {
            return reject("missing_device_id", payload);
        }

        Instant timestamp = parseTimestamp(node.get("timestamp"));
        if (timestamp == null) {
            return reject(node.hasNonNull("timestamp") ? "bad_timestamp" : "missing_timestamp", payload);
        }

        Double temperature = parseNumber(node.get("temperature"));
        if (temperature == null) {
            return reject(node.hasNonNull("temperature") ? "bad_temperature" : "missing_temperature", payload);
        }

        Double humidity = parseNumber(node.get("humidity"));
        if (humidity == null) {
            return reject(node.hasNonNull("humidity") ? "bad_humidity" : "missing_humidity", payload);
        }

        JsonNode locationNode = node.get("location");
        String location = locationNode != null && locationNode.isTextual() && !locationNode.asText().isBlank()
            ? locationNode.asText()
            : ProcessingConstants.UNKNOWN_LOCATION;

        return Optional.of(TelemetryRecord.builder()
            .deviceId(deviceNode.asText().trim())
            .timestamp(timestamp)
            .temperature(temperature)
            .humidity(humidity)
            .location(location)
            .build());
    }

    private Optional<TelemetryRecord> reject(String reason, String payload) {
        metrics.incMalformed(reason);
        if (log.isDebugEnabled()) {
            log.debug("{} Dropped entry ({}): {}", LOG_PREFIX, reason, abbreviate(payload));
        }
        return Optional.empty();
    }

    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? Instant.ofEpochMilli(node.asLong()) : null;
        }
        if (!node.isTextual()) {
            return null;
        }
        String text = node.asText().trim();
        Instant parsed;
        try {
            parsed = Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                parsed = OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
        return representableInMillis(parsed) ? parsed : null;
    }

    // windows and alert ids work in epoch milliseconds
    private static boolean representableInMillis(Instant instant) {
        return !instant.isBefore(MIN_TIMESTAMP) && !instant.isAfter(MAX_TIMESTAMP);
    }

    static Double parseNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "null";
        }
        return payload.length() > 200 ? payload.substring(0, 200) + "..." : payload;
    }
}
