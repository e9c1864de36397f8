package com.iotwatch.anomaly.dispatch.sink;

import com.iotwatch.anomaly.dispatch.AnomalySink;
import com.iotwatch.anomaly.model.AnnotatedRecord;
import com.iotwatch.anomaly.model.AnomalyRecord;
import com.iotwatch.anomaly.repository.AnomalyRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Anomaly store. Documents are keyed by record id, so a redelivery overwrites.
 */
@Component
@Slf4j
public class MongoAnomalySink implements AnomalySink {

    public static final String NAME = "mongo-anomalies";

    private final AnomalyRecordRepository repository;

    public MongoAnomalySink(AnomalyRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(AnnotatedRecord record) {
        AnomalyRecord saved = repository.save(AnomalyRecord.from(record));
        log.debug("[SINK:{}] Stored anomaly {} rules={}", NAME, saved.getId(), saved.getRuleIds());
    }

    public List<AnomalyRecord> findByDevice(String deviceId, Instant from, Instant to) {
        return repository.findByDeviceIdAndTimestampBetweenOrderByTimestampDesc(deviceId, from, to);
    }
}
