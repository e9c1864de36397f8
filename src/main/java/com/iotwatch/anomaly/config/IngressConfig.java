package com.iotwatch.anomaly.config;

import com.iotwatch.anomaly.ingress.FileTelemetrySource;
import com.iotwatch.anomaly.ingress.KafkaTelemetrySource;
import com.iotwatch.anomaly.ingress.TelemetrySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;

import java.nio.file.Path;

/**
 * Picks the telemetry transport from {@code pipeline.ingress.type}.
 */
@Configuration
@Slf4j
public class IngressConfig {

    @Bean
    public TelemetrySource telemetrySource(PipelineProperties properties,
                                           ConsumerFactory<String, String> telemetryConsumerFactory) {
        PipelineProperties.Ingress ingress = properties.getIngress();
        String type = ingress.getType() == null ? "" : ingress.getType().trim().toLowerCase();
        switch (type) {
            case "kafka":
                log.info("[INGRESS] Using Kafka topic {} (group {})", ingress.getTopic(), ingress.getConsumerGroup());
                return new KafkaTelemetrySource(ingress.getTopic(), telemetryConsumerFactory::createConsumer);
            case "file":
                log.info("[INGRESS] Using JSON-lines file {}", ingress.getFile());
                return new FileTelemetrySource(Path.of(ingress.getFile()), ingress.getMaxPollRecords());
            default:
                throw new IllegalStateException("Unknown pipeline.ingress.type '" + ingress.getType()
                    + "', expected kafka or file");
        }
    }
}
