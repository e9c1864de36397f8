package com.iotwatch.anomaly.repository;

import com.iotwatch.anomaly.model.AnomalyRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * AnomalyRecordRepository - anomalous readings, queried by device and time range.
 */
@Repository
public interface AnomalyRecordRepository extends MongoRepository<AnomalyRecord, String> {

    /**
     * Anomalies of one device in {@code [from, to]}, newest first.
     */
    List<AnomalyRecord> findByDeviceIdAndTimestampBetweenOrderByTimestampDesc(
        String deviceId, Instant from, Instant to);
}
