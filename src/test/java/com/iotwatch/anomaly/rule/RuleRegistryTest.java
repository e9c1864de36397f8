package com.iotwatch.anomaly.rule;

import com.iotwatch.anomaly.config.PipelineProperties;
import com.iotwatch.anomaly.dispatch.FailureReporter;
import com.iotwatch.anomaly.model.OperatorFailure;
import com.iotwatch.anomaly.support.RecordingSinks;
import com.iotwatch.anomaly.support.Telemetry;
import com.iotwatch.anomaly.support.TestRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuleRegistry")
class RuleRegistryTest {

    private FailureReporter failureReporter;
    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getRules().setLocation("classpath:rules/valid-rules.json");
        failureReporter = new FailureReporter(properties);
        RuleSetLoader loader = new RuleSetLoader(new DefaultResourceLoader(), Telemetry.objectMapper(), properties);
        registry = new RuleRegistry(loader,
            List.of(new RecordingSinks.Channel("log"), new RecordingSinks.Channel("kafka")), failureReporter);
    }

    @Test
    @DisplayName("Initial load publishes version 1 from the configured file")
    void initialLoad() {
        registry.loadInitial();

        RuleSet current = registry.current();
        assertEquals(1, current.getVersion());
        assertEquals(2, current.size());
        assertTrue(current.contains("high-temperature"));
        assertEquals(Duration.ofSeconds(60), current.find("high-temperature").orElseThrow().getCooldown());
        assertEquals(Set.of("log", "kafka"), registry.getChannelNames());
    }

    @Test
    @DisplayName("A valid reload publishes a new version")
    void reloadIncrementsVersion() {
        RuleSet first = registry.reload(List.of(TestRules.hotRule("hot", 100, Duration.ZERO)));
        RuleSet second = registry.reload(List.of(TestRules.hotRule("hot", 90, Duration.ZERO)));

        assertEquals(first.getVersion() + 1, second.getVersion());
        assertSame(second, registry.current());
        assertEquals(90.0, registry.current().find("hot").orElseThrow().getPredicate().getThreshold());
    }

    @Test
    @DisplayName("An invalid candidate lists every problem and leaves the active set untouched")
    void invalidCandidateRejected() {
        RuleSet active = registry.reload(List.of(TestRules.hotRule("hot", 100, Duration.ZERO)));
        List<AlertRule> candidate = new ArrayList<>();
        candidate.add(TestRules.hotRule("dup", 1, Duration.ZERO));
        candidate.add(TestRules.hotRule("dup", 2, Duration.ZERO));
        candidate.add(TestRules.rule("no-field", null, ComparisonOperator.GT, 1, Duration.ZERO, "log"));
        candidate.add(TestRules.rule("bad-cooldown", TelemetryField.TEMPERATURE, ComparisonOperator.GT, 1,
            Duration.ofSeconds(-5), "log"));
        candidate.add(TestRules.rule("pager", TelemetryField.TEMPERATURE, ComparisonOperator.GT, 1,
            Duration.ZERO, "pagerduty"));
        candidate.add(TestRules.rule("nan", TelemetryField.TEMPERATURE, ComparisonOperator.GT, Double.NaN,
            Duration.ZERO, "log"));
        candidate.add(AlertRule.builder().predicate(null).action(null).cooldown(null).build());

        RuleValidationException ex = assertThrows(RuleValidationException.class, () -> registry.reload(candidate));

        List<String> errors = ex.getErrors();
        assertTrue(errors.contains("rule 'dup': duplicate id"));
        assertTrue(errors.contains("rule 'no-field': unknown or missing predicate field"));
        assertTrue(errors.contains("rule 'bad-cooldown': cooldown must not be negative"));
        assertTrue(errors.contains("rule 'pager': unknown channel 'pagerduty'"));
        assertTrue(errors.contains("rule 'nan': threshold must be a finite number"));
        assertTrue(errors.contains("rule[6]: id is required"));
        assertTrue(errors.contains("rule[6]: predicate is required"));
        assertTrue(errors.contains("rule[6]: cooldown is required"));
        assertTrue(errors.contains("rule[6]: action needs at least one channel"));
        assertSame(active, registry.current());

        List<OperatorFailure> failures = failureReporter.recent();
        assertEquals(OperatorFailure.Category.CONFIGURATION_REJECTED, failures.get(0).getCategory());
    }

    @Test
    @DisplayName("A rule file entry without a usable threshold is rejected rather than compared against zero")
    void missingThresholdRejected() throws Exception {
        RuleSet active = registry.reload(List.of(TestRules.hotRule("hot", 100, Duration.ZERO)));
        String json = "[{\"id\":\"no-threshold\",\"predicate\":{\"field\":\"temperature\",\"comparator\":\">\"},"
            + "\"action\":{\"channels\":[\"log\"]},\"cooldown\":\"PT1M\"},"
            + "{\"id\":\"typo\",\"predicate\":{\"field\":\"temperature\",\"comparator\":\">\",\"treshold\":100},"
            + "\"action\":{\"channels\":[\"log\"]},\"cooldown\":\"PT1M\"}]";
        PipelineProperties properties = new PipelineProperties();
        List<AlertRule> parsed = new RuleSetLoader(new DefaultResourceLoader(), Telemetry.objectMapper(), properties)
            .parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        RuleValidationException ex = assertThrows(RuleValidationException.class, () -> registry.reload(parsed));

        assertEquals(List.of("rule 'no-threshold': threshold is required", "rule 'typo': threshold is required"),
            ex.getErrors());
        assertSame(active, registry.current());
    }

    @Test
    @DisplayName("An empty rule list is valid")
    void emptyListAllowed() {
        RuleSet empty = registry.reload(List.of());

        assertEquals(0, empty.size());
    }

    @Test
    @DisplayName("A broken rule file on reload is reported and keeps the active set")
    void brokenFileOnReload() {
        registry.loadInitial();
        RuleSet active = registry.current();
        PipelineProperties properties = new PipelineProperties();
        properties.getRules().setLocation("classpath:rules/does-not-exist.json");
        RuleRegistry broken = new RuleRegistry(
            new RuleSetLoader(new DefaultResourceLoader(), Telemetry.objectMapper(), properties),
            List.of(new RecordingSinks.Channel("log")), failureReporter);

        assertThrows(RuleValidationException.class, broken::reloadFromSource);
        assertSame(active, registry.current());
        assertEquals(0, broken.current().getVersion());
    }

    @Test
    @DisplayName("Readers racing a reload see either the old or the new set, never a mix")
    void readersSeeWholeSnapshots() throws InterruptedException {
        registry.reload(List.of(TestRules.hotRule("a1", 1, Duration.ZERO), TestRules.hotRule("a2", 1, Duration.ZERO)));
        AtomicBoolean stop = new AtomicBoolean();
        Set<String> observed = ConcurrentHashMap.newKeySet();
        Thread reader = new Thread(() -> {
            while (!stop.get()) {
                RuleSet snapshot = registry.current();
                StringBuilder ids = new StringBuilder();
                snapshot.getRules().forEach(r -> ids.append(r.getId()));
                observed.add(ids.toString());
            }
        });
        reader.start();
        for (int i = 0; i < 200; i++) {
            registry.reload(i % 2 == 0
                ? List.of(TestRules.hotRule("b1", 1, Duration.ZERO), TestRules.hotRule("b2", 1, Duration.ZERO))
                : List.of(TestRules.hotRule("a1", 1, Duration.ZERO), TestRules.hotRule("a2", 1, Duration.ZERO)));
        }
        stop.set(true);
        reader.join(5_000);

        assertTrue(Set.of("a1a2", "b1b2").containsAll(observed), "observed " + observed);
    }
}
