package com.iotwatch.anomaly.pipeline;

import com.iotwatch.anomaly.classifier.AnomalyClassifier;
import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.dispatch.DeadLetterQueue;
import com.iotwatch.anomaly.dispatch.DeliveryAckTracker;
import com.iotwatch.anomaly.dispatch.FailureReporter;
import com.iotwatch.anomaly.dispatch.LaneSettings;
import com.iotwatch.anomaly.dispatch.SinkDispatcher;
import com.iotwatch.anomaly.ingress.IngressAdapter;
import com.iotwatch.anomaly.ingress.IngressCursor;
import com.iotwatch.anomaly.ingress.TelemetryParser;
import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.AlertEvent;
import com.iotwatch.anomaly.model.OperatorFailure;
import com.iotwatch.anomaly.model.WindowSnapshot;
import com.iotwatch.anomaly.retry.RetryHandler;
import com.iotwatch.anomaly.rule.RuleRegistry;
import com.iotwatch.anomaly.support.Eventually;
import com.iotwatch.anomaly.support.InMemoryTelemetrySource;
import com.iotwatch.anomaly.support.RecordingSinks;
import com.iotwatch.anomaly.support.Telemetry;
import com.iotwatch.anomaly.support.TestRules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static com.iotwatch.anomaly.support.Telemetry.T0;
import static com.iotwatch.anomaly.support.Telemetry.json;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TelemetryPipeline")
class TelemetryPipelineTest {

    private PipelineProperties properties;
    private PipelineMetrics metrics;
    private FailureReporter failureReporter;
    private RuleRegistry registry;
    private RecordingSinks.Anomalies anomalies;
    private RecordingSinks.Windows windows;
    private RecordingSinks.Channel logChannel;
    private final AtomicLong clock = new AtomicLong(1_000_000);
    private final List<TelemetryPipeline> started = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getPartitions().setCount(2);
        properties.getPartitions().setQueueCapacity(100);
        properties.getPartitions().setOfferTimeout(Duration.ofMillis(200));
        properties.getWindow().setSize(Duration.ofSeconds(60));
        properties.getWindow().setGrace(Duration.ofSeconds(10));
        properties.getWindow().setIdleTimeout(Duration.ofSeconds(30));
        properties.getWindow().setIdleCheckInterval(Duration.ofMillis(10));
        properties.getIngress().setPollTimeout(Duration.ofMillis(20));
        properties.setShutdownTimeout(Duration.ofSeconds(5));

        metrics = new PipelineMetrics();
        failureReporter = new FailureReporter(properties);
        anomalies = new RecordingSinks.Anomalies("anomalies");
        windows = new RecordingSinks.Windows("windows");
        logChannel = new RecordingSinks.Channel("log");
        registry = TestRules.registry(List.of(logChannel));
        registry.reload(List.of(TestRules.hotRule("hot", 100, Duration.ofSeconds(60))));
    }

    @AfterEach
    void tearDown() {
        started.forEach(TelemetryPipeline::stop);
    }

    private TelemetryPipeline pipeline(InMemoryTelemetrySource source, int ingressAttempts) {
        IngressAdapter ingress = new IngressAdapter(source, new TelemetryParser(Telemetry.objectMapper(), metrics),
            new RetryHandler(), Telemetry.fastRetry(ingressAttempts), metrics);
        LaneSettings lanes = LaneSettings.builder()
            .queueCapacity(100)
            .offerTimeout(Duration.ofMillis(200))
            .callTimeout(Duration.ofSeconds(1))
            .callConcurrency(1)
            .retryPolicy(Telemetry.fastRetry(3))
            .build();
        SinkDispatcher dispatcher = new SinkDispatcher(List.of(anomalies), List.of(windows), List.of(logChannel),
            lanes, properties.getShutdownTimeout(), new RetryHandler(),
            new DeliveryAckTracker(1_000, Duration.ofMinutes(5)), new DeadLetterQueue(100, metrics),
            failureReporter, metrics);
        TelemetryPipeline pipeline = new TelemetryPipeline(ingress, new AnomalyClassifier(registry), registry,
            dispatcher, failureReporter, properties, metrics, clock::get);
        started.add(pipeline);
        return pipeline;
    }

    @Test
    @DisplayName("End to end: anomalies, windows and cooldown-limited alerts reach the sinks")
    void endToEnd() {
        InMemoryTelemetrySource source = new InMemoryTelemetrySource(10, List.of(
            json("DEV001", 0, 150, 40),
            json("DEV001", 10, 150, 40),
            "not json",
            json("DEV001", 70, 150, 40),
            json("DEV001", 140, 20, 40)));
        TelemetryPipeline pipeline = pipeline(source, 3);

        pipeline.start(IngressCursor.empty());
        assertTrue(pipeline.isRunning());
        Eventually.await("records ingested", () -> metrics.getRecordsIngested() == 4);
        Eventually.await("closed windows delivered", () -> windows.delivered().size() == 2);
        pipeline.stop();

        assertEquals(TelemetryPipeline.State.STOPPED, pipeline.getState());
        assertEquals(3, anomalies.delivered().size());
        assertEquals(1, metrics.getMalformedTotal());

        List<AlertEvent> alerts = logChannel.delivered();
        assertEquals(List.of(T0, T0.plusSeconds(70)),
            alerts.stream().map(AlertEvent::getTimestamp).collect(Collectors.toList()));
        assertEquals(1L, metrics.getSuppressedByRule().get("hot"));

        List<WindowSnapshot> delivered = windows.delivered();
        assertEquals(3, delivered.size(), "two closed by watermark, one flushed at shutdown");
        assertEquals(List.of(2L, 1L, 1L),
            delivered.stream().map(WindowSnapshot::getCount).collect(Collectors.toList()));
        assertEquals(T0.plusSeconds(120), delivered.get(2).getWindowStart());

        assertEquals(IngressCursor.of(Map.of(0, 5L)), source.committed());
        assertTrue(source.isClosed());
    }

    @Test
    @DisplayName("Devices are processed independently across partitions")
    void manyDevices() {
        List<String> payloads = new ArrayList<>();
        for (int t = 0; t < 20; t++) {
            for (int d = 0; d < 6; d++) {
                payloads.add(json("DEV" + d, t * 10L, 20 + t, 40));
            }
        }
        InMemoryTelemetrySource source = new InMemoryTelemetrySource(7, payloads);
        TelemetryPipeline pipeline = pipeline(source, 3);

        pipeline.start(IngressCursor.empty());
        Eventually.await("all ingested", () -> metrics.getRecordsIngested() == 120);
        pipeline.stop();

        List<WindowSnapshot> delivered = windows.delivered();
        long total = delivered.stream().mapToLong(WindowSnapshot::getCount).sum();
        assertEquals(120, total + metrics.getLateRecordsDropped());
        assertEquals(0, metrics.getLateRecordsDropped());
        for (int d = 0; d < 6; d++) {
            String device = "DEV" + d;
            List<WindowSnapshot> perDevice = delivered.stream()
                .filter(w -> w.getDeviceId().equals(device))
                .collect(Collectors.toList());
            for (int i = 1; i < perDevice.size(); i++) {
                assertTrue(perDevice.get(i - 1).getWindowStart().isBefore(perDevice.get(i).getWindowStart()),
                    "windows of " + device + " in order");
            }
        }
        assertTrue(logChannel.delivered().isEmpty());
    }

    @Test
    @DisplayName("A silent device is flushed by the idle check while the pipeline runs")
    void idleFlush() {
        InMemoryTelemetrySource source = new InMemoryTelemetrySource(10, List.of(json("DEV001", 0, 20, 40)));
        TelemetryPipeline pipeline = pipeline(source, 3);

        pipeline.start(IngressCursor.empty());
        Eventually.await("ingested", () -> metrics.getRecordsIngested() == 1);
        assertTrue(windows.delivered().isEmpty());

        clock.addAndGet(Duration.ofSeconds(31).toMillis());

        Eventually.await("idle window delivered", () -> windows.delivered().size() == 1);
        assertTrue(pipeline.isRunning());
        assertEquals(1, metrics.getIdleFlushes());
    }

    @Test
    @DisplayName("Ingress retry exhaustion is reported and stops the pipeline in FAILED")
    void ingressFailureIsTerminal() {
        InMemoryTelemetrySource source = new InMemoryTelemetrySource(10, List.of()).permanentlyDown();
        TelemetryPipeline pipeline = pipeline(source, 2);

        pipeline.start(IngressCursor.empty());

        Eventually.await("failed", () -> pipeline.getState() == TelemetryPipeline.State.FAILED);
        OperatorFailure failure = failureReporter.recent().get(0);
        assertEquals(OperatorFailure.Category.INGRESS_TERMINAL, failure.getCategory());
        assertEquals("ingress:memory", failure.getComponent());
        assertFalse(pipeline.isRunning());
    }

    @Test
    @DisplayName("A restarted pipeline resumes after the committed position")
    void restartResumes() {
        InMemoryTelemetrySource source = new InMemoryTelemetrySource(10, List.of(
            json("DEV001", 0, 150, 40), json("DEV001", 5, 20, 40)));

        TelemetryPipeline first = pipeline(source, 3);
        first.start(IngressCursor.empty());
        Eventually.await("first batch", () -> metrics.getRecordsIngested() == 2);
        first.stop();
        assertEquals(IngressCursor.of(Map.of(0, 2L)), source.committed());

        source.append(json("DEV001", 200, 150, 40));
        TelemetryPipeline second = pipeline(source, 3);
        second.start(IngressCursor.empty());
        Eventually.await("second batch", () -> metrics.getRecordsIngested() == 3);
        second.stop();

        assertEquals(IngressCursor.of(Map.of(0, 3L)), source.committed());
        assertEquals(2, anomalies.delivered().size());
    }

    @Test
    @DisplayName("The position is not committed when a sink does not drain before the shutdown timeout")
    void undrainedShutdownSkipsCommit() {
        properties.setShutdownTimeout(Duration.ofMillis(300));
        anomalies.hang(10_000);
        InMemoryTelemetrySource source = new InMemoryTelemetrySource(10, List.of(
            json("DEV001", 0, 150, 40), json("DEV001", 5, 20, 40)));
        TelemetryPipeline pipeline = pipeline(source, 3);

        try {
            pipeline.start(IngressCursor.empty());
            Eventually.await("ingested", () -> metrics.getRecordsIngested() == 2);
            Eventually.await("anomaly delivery in flight", () -> anomalies.attempts() >= 1);
            pipeline.stop();
        } finally {
            anomalies.release();
        }

        assertEquals(TelemetryPipeline.State.STOPPED, pipeline.getState());
        assertNull(source.committed());
        assertTrue(source.isClosed());
    }

    @Test
    @DisplayName("A pipeline starts once")
    void startOnce() {
        TelemetryPipeline pipeline = pipeline(new InMemoryTelemetrySource(10, List.of()), 3);

        pipeline.start(IngressCursor.empty());

        assertThrows(IllegalStateException.class, () -> pipeline.start(IngressCursor.empty()));
        pipeline.stop();
        assertEquals(TelemetryPipeline.State.STOPPED, pipeline.getState());
    }
}
