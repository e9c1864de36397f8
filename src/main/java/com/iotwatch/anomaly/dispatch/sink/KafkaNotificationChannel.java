package com.iotwatch.anomaly.dispatch.sink;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.dispatch.NotificationChannel;
import com.iotwatch.anomaly.model.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Publishes alerts to the alert topic, keyed by device so a device's alerts stay ordered.
 * The send is awaited so a broker failure counts as a failed attempt.
 */
@Component
@ConditionalOnProperty(name = "pipeline.sinks.kafka-alerts-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class KafkaNotificationChannel implements NotificationChannel {

    public static final String NAME = "kafka";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final long sendTimeoutMs;

    public KafkaNotificationChannel(KafkaTemplate<String, Object> kafkaTemplate, PipelineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getSinks().getAlertTopic();
        this.sendTimeoutMs = properties.getSinks().getCallTimeout().toMillis();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(AlertEvent alert) throws Exception {
        SendResult<String, Object> result = kafkaTemplate.send(topic, alert.getDeviceId(), alert)
            .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
        log.debug("[SINK:{}] Alert {} published to {}-{}@{}", NAME, alert.getId(), topic,
            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
    }
}
