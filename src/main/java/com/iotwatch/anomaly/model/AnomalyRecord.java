package com.iotwatch.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored projection of an anomalous record, queried by device and time range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "telemetry_anomalies")
@CompoundIndex(name = "device_timestamp_idx", def = "{'deviceId': 1, 'timestamp': -1}")
public class AnomalyRecord {

    @Id
    private String id;

    private String deviceId;

    @Indexed(expireAfter = "30d")
    private Instant timestamp;

    private double temperature;
    private double humidity;
    private String location;
    private List<String> ruleIds;
    private long ruleSetVersion;

    public static AnomalyRecord from(AnnotatedRecord annotated) {
        TelemetryRecord record = annotated.getRecord();
        return AnomalyRecord.builder()
            .id(annotated.recordId())
            .deviceId(record.getDeviceId())
            .timestamp(record.getTimestamp())
            .temperature(record.getTemperature())
            .humidity(record.getHumidity())
            .location(record.getLocation())
            .ruleIds(new ArrayList<>(annotated.getMatches().keySet()))
            .ruleSetVersion(annotated.ruleSetVersion())
            .build();
    }
}
