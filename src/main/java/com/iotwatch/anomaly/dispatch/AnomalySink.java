package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.model.AnnotatedRecord;

/**
 * Receives every record classified as anomalous.
 */
public interface AnomalySink extends DeliveryTarget<AnnotatedRecord> {
}
