package com.iotwatch.anomaly.dispatch.sink;

import com.iotwatch.anomaly.dispatch.NotificationChannel;
import com.iotwatch.anomaly.model.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(AlertEvent alert) {
        log.warn("[ALERT] rule={} device={} {}={} threshold={} at {}", alert.getRuleId(), alert.getDeviceId(),
            alert.getField().getKey(), alert.getTriggerValue(), alert.getThreshold(), alert.getTimestamp());
    }
}
