package com.iotwatch.anomaly.dispatch;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.model.OperatorFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FailureReporter - the single place operator-visible failures go through.
 *
 * Every failure is logged at ERROR and kept in a bounded history for the operations API.
 * When {@code pipeline.failures.topic} is set and Kafka is wired, it is also published there.
 * Publishing is best effort: a report never throws.
 */
@Component
@Slf4j
public class FailureReporter {

    private final int historySize;
    private final String topic;
    private final Deque<OperatorFailure> recent = new ArrayDeque<>();

    @Autowired(required = false)
    private KafkaTemplate<String, Object> kafkaTemplate;

    public FailureReporter(PipelineProperties properties) {
        this.historySize = Math.max(1, properties.getFailures().getHistorySize());
        this.topic = properties.getFailures().getTopic();
    }

    public OperatorFailure report(OperatorFailure.Category category, String component, String message) {
        OperatorFailure failure = OperatorFailure.builder()
            .category(category)
            .component(component)
            .message(message)
            .occurredAt(Instant.now())
            .build();

        log.error("[OPERATOR-FAILURE] {} in {}: {}", category, component, message);

        synchronized (recent) {
            recent.addFirst(failure);
            while (recent.size() > historySize) {
                recent.removeLast();
            }
        }

        publish(failure);
        return failure;
    }

    /**
     * Most recent failures first.
     */
    public List<OperatorFailure> recent() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    private void publish(OperatorFailure failure) {
        if (kafkaTemplate == null || topic == null || topic.isBlank()) {
            return;
        }
        try {
            kafkaTemplate.send(topic, failure.getComponent(), failure)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("[OPERATOR-FAILURE] Could not publish failure to {}: {}", topic, ex.getMessage());
                    }
                });
        } catch (RuntimeException e) {
            log.warn("[OPERATOR-FAILURE] Could not publish failure to {}: {}", topic, e.getMessage());
        }
    }
}
