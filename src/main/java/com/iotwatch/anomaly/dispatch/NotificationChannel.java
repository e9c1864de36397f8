package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.model.AlertEvent;

/**
 * Alert destination. Rules refer to channels by {@link #name()}.
 */
public interface NotificationChannel extends DeliveryTarget<AlertEvent> {
}
