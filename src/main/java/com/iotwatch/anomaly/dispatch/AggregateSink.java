package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.model.WindowSnapshot;

/**
 * Receives finalized windows. Writes must be idempotent per window id.
 */
public interface AggregateSink extends DeliveryTarget<WindowSnapshot> {
}
