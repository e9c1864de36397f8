package com.iotwatch.anomaly.repository;

import com.iotwatch.anomaly.model.WindowSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Finalized windows, one document per (device, window start).
 */
@Repository
public interface WindowSnapshotRepository extends MongoRepository<WindowSnapshot, String> {
}
