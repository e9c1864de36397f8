package com.iotwatch.anomaly.ingress;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("KafkaTelemetrySource")
class KafkaTelemetrySourceTest {

    private static final String TOPIC = "telemetry-raw";
    private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
    private static final TopicPartition P1 = new TopicPartition(TOPIC, 1);

    private MockConsumer<String, String> consumer;
    private KafkaTelemetrySource source;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        Node node = new Node(0, "localhost", 9092);
        consumer.updatePartitions(TOPIC, List.of(
            new PartitionInfo(TOPIC, 0, node, new Node[]{node}, new Node[]{node}),
            new PartitionInfo(TOPIC, 1, node, new Node[]{node}, new Node[]{node})));
        consumer.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
        source = new KafkaTelemetrySource(TOPIC, () -> consumer);
    }

    private void addRecords(TopicPartition tp, int count) {
        for (int i = 0; i < count; i++) {
            consumer.addRecord(new ConsumerRecord<>(TOPIC, tp.partition(), i, "DEV" + i, "payload-" + tp.partition() + "-" + i));
        }
    }

    @Test
    @DisplayName("Assigns every partition and reads from the beginning without a cursor")
    void readsAllPartitions() throws TransportException {
        source.connect(IngressCursor.empty());
        addRecords(P0, 2);
        addRecords(P1, 1);

        List<SourceEntry> entries = source.poll(Duration.ofMillis(10));

        assertEquals(Set.of(P0, P1), consumer.assignment());
        assertEquals(3, entries.size());
        assertTrue(entries.contains(new SourceEntry(1, 0, "payload-1-0")));
    }

    @Test
    @DisplayName("An explicit cursor seeks each partition it names")
    void seeksToCursor() throws TransportException {
        source.connect(IngressCursor.of(Map.of(0, 2L)));
        addRecords(P0, 4);

        List<SourceEntry> entries = source.poll(Duration.ofMillis(10));

        assertEquals(2, entries.size());
        assertEquals(2L, entries.get(0).getOffset());
        assertEquals(3L, entries.get(1).getOffset());
    }

    @Test
    @DisplayName("Without a cursor the group's committed offset is used; partitions without one keep the reset policy")
    void fallsBackToCommittedOffset() throws TransportException {
        @SuppressWarnings("unchecked")
        Consumer<String, String> kafka = mock(Consumer.class);
        Node node = new Node(0, "localhost", 9092);
        when(kafka.partitionsFor(eq(TOPIC), any(Duration.class))).thenReturn(List.of(
            new PartitionInfo(TOPIC, 0, node, new Node[]{node}, new Node[]{node}),
            new PartitionInfo(TOPIC, 1, node, new Node[]{node}, new Node[]{node})));
        when(kafka.committed(anySet())).thenReturn(Map.of(P1, new OffsetAndMetadata(1L)));

        new KafkaTelemetrySource(TOPIC, () -> kafka).connect(IngressCursor.empty());

        verify(kafka).assign(List.of(P0, P1));
        verify(kafka).committed(Set.of(P0, P1));
        verify(kafka).seek(P1, 1L);
        verify(kafka, never()).seek(eq(P0), anyLong());
    }

    @Test
    @DisplayName("A cursor position wins over the committed offset")
    void cursorWinsOverCommittedOffset() throws TransportException {
        @SuppressWarnings("unchecked")
        Consumer<String, String> kafka = mock(Consumer.class);
        Node node = new Node(0, "localhost", 9092);
        when(kafka.partitionsFor(eq(TOPIC), any(Duration.class))).thenReturn(List.of(
            new PartitionInfo(TOPIC, 0, node, new Node[]{node}, new Node[]{node}),
            new PartitionInfo(TOPIC, 1, node, new Node[]{node}, new Node[]{node})));
        when(kafka.committed(anySet())).thenReturn(Map.of(P1, new OffsetAndMetadata(1L)));

        new KafkaTelemetrySource(TOPIC, () -> kafka).connect(IngressCursor.of(Map.of(0, 4L, 1, 9L)));

        verify(kafka).seek(P0, 4L);
        verify(kafka).seek(P1, 9L);
        verify(kafka, never()).committed(anySet());
    }

    @Test
    @DisplayName("A failed connect closes the consumer it created")
    void failedConnectClosesConsumer() {
        List<MockConsumer<String, String>> created = new ArrayList<>();
        KafkaTelemetrySource missing = new KafkaTelemetrySource("nope", () -> {
            MockConsumer<String, String> fresh = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
            created.add(fresh);
            return fresh;
        });

        for (int attempt = 0; attempt < 3; attempt++) {
            assertThrows(TransportException.class, () -> missing.connect(IngressCursor.empty()));
        }

        assertEquals(3, created.size());
        assertTrue(created.stream().allMatch(MockConsumer::closed));
    }

    @Test
    @DisplayName("Reconnecting closes the previous consumer first")
    void reconnectClosesPreviousConsumer() throws TransportException {
        MockConsumer<String, String> second = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        second.updatePartitions(TOPIC, consumer.partitionsFor(TOPIC));
        second.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
        List<MockConsumer<String, String>> handedOut = new ArrayList<>(List.of(consumer, second));
        KafkaTelemetrySource reconnecting = new KafkaTelemetrySource(TOPIC, () -> handedOut.remove(0));

        reconnecting.connect(IngressCursor.empty());
        reconnecting.connect(IngressCursor.empty());

        assertTrue(consumer.closed());
        assertFalse(second.closed());
    }

    @Test
    @DisplayName("Commit writes next offsets per partition")
    void commitWritesOffsets() throws TransportException {
        source.connect(IngressCursor.empty());

        source.commit(IngressCursor.of(Map.of(0, 5L, 1, 7L)));

        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(Set.of(P0, P1));
        assertEquals(5L, committed.get(P0).offset());
        assertEquals(7L, committed.get(P1).offset());
    }

    @Test
    @DisplayName("Broker errors surface as transport failures")
    void pollErrorBecomesTransportException() throws TransportException {
        source.connect(IngressCursor.empty());
        consumer.setPollException(new KafkaException("broker gone"));

        assertThrows(TransportException.class, () -> source.poll(Duration.ofMillis(10)));
    }

    @Test
    @DisplayName("A missing topic fails the connect; polling unconnected fails too")
    void missingTopic() {
        KafkaTelemetrySource missing = new KafkaTelemetrySource("nope", () -> consumer);

        assertThrows(TransportException.class, () -> missing.connect(IngressCursor.empty()));
        assertThrows(TransportException.class, () -> new KafkaTelemetrySource(TOPIC, () -> consumer)
            .poll(Duration.ofMillis(1)));
    }

    @Test
    @DisplayName("Close releases the consumer")
    void closeReleasesConsumer() throws TransportException {
        source.connect(IngressCursor.empty());
        source.close();

        assertTrue(consumer.closed());
        assertEquals("kafka:" + TOPIC, source.describe());
    }
}
