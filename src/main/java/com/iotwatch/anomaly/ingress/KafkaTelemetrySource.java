package com.iotwatch.anomaly.ingress;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Kafka-backed telemetry source.
 *
 * Partitions are assigned manually (no group rebalancing) so the adapter fully
 * controls positions: an explicit cursor wins, then the group's committed offset,
 * then the consumer's {@code auto.offset.reset} policy.
 */
@Slf4j
public class KafkaTelemetrySource implements TelemetrySource {

    private static final String LOG_PREFIX = "[INGRESS-KAFKA]";
    private static final Duration METADATA_TIMEOUT = Duration.ofSeconds(10);

    private final String topic;
    private final Supplier<Consumer<String, String>> consumerFactory;
    private Consumer<String, String> consumer;

    public KafkaTelemetrySource(String topic, Supplier<Consumer<String, String>> consumerFactory) {
        this.topic = topic;
        this.consumerFactory = consumerFactory;
    }

    @Override
    public void connect(IngressCursor from) throws TransportException {
        close();
        Consumer<String, String> candidate = consumerFactory.get();
        try {
            assignAndSeek(candidate, from);
        } catch (KafkaException e) {
            closeQuietly(candidate);
            throw new TransportException("Cannot connect to topic " + topic + ": " + e.getMessage(), e);
        } catch (TransportException | RuntimeException e) {
            closeQuietly(candidate);
            throw e;
        }
        consumer = candidate;
    }

    private void assignAndSeek(Consumer<String, String> kafka, IngressCursor from) throws TransportException {
        List<PartitionInfo> infos = kafka.partitionsFor(topic, METADATA_TIMEOUT);
        if (infos == null || infos.isEmpty()) {
            throw new TransportException("Topic " + topic + " has no partitions or does not exist");
        }
        List<TopicPartition> partitions = new ArrayList<>();
        for (PartitionInfo info : infos) {
            partitions.add(new TopicPartition(topic, info.partition()));
        }
        kafka.assign(partitions);

        Set<TopicPartition> unresolved = new HashSet<>();
        for (TopicPartition tp : partitions) {
            Optional<Long> offset = from.nextOffset(tp.partition());
            if (offset.isPresent()) {
                kafka.seek(tp, offset.get());
            } else {
                unresolved.add(tp);
            }
        }
        if (!unresolved.isEmpty()) {
            Map<TopicPartition, OffsetAndMetadata> committed = kafka.committed(unresolved);
            committed.forEach((tp, meta) -> {
                if (meta != null) {
                    kafka.seek(tp, meta.offset());
                }
            });
        }
        log.info("{} Connected to {} ({} partitions) from {}", LOG_PREFIX, topic, partitions.size(), from);
    }

    @Override
    public List<SourceEntry> poll(Duration timeout) throws TransportException {
        if (consumer == null) {
            throw new TransportException("Source for " + topic + " is not connected");
        }
        try {
            ConsumerRecords<String, String> records = consumer.poll(timeout);
            List<SourceEntry> entries = new ArrayList<>(records.count());
            for (ConsumerRecord<String, String> record : records) {
                entries.add(new SourceEntry(record.partition(), record.offset(), record.value()));
            }
            return entries;
        } catch (KafkaException e) {
            throw new TransportException("Poll on " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void commit(IngressCursor position) throws TransportException {
        if (consumer == null || position.isEmpty()) {
            return;
        }
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        position.getNextOffsets().forEach((partition, offset) ->
            offsets.put(new TopicPartition(topic, partition), new OffsetAndMetadata(offset)));
        try {
            consumer.commitSync(offsets);
            log.info("{} Committed {} for {}", LOG_PREFIX, position, topic);
        } catch (KafkaException e) {
            throw new TransportException("Commit on " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "kafka:" + topic;
    }

    @Override
    public void close() {
        if (consumer == null) {
            return;
        }
        try {
            closeQuietly(consumer);
        } finally {
            consumer = null;
        }
    }

    private void closeQuietly(Consumer<String, String> target) {
        try {
            target.close(Duration.ofSeconds(5));
        } catch (KafkaException e) {
            log.warn("{} Error closing consumer for {}: {}", LOG_PREFIX, topic, e.getMessage());
        }
    }
}
