package com.iotwatch.anomaly.classifier;

import com.iotwatch.anomaly.model.AnnotatedRecord;
import com.iotwatch.anomaly.rule.ComparisonOperator;
import com.iotwatch.anomaly.rule.RuleRegistry;
import com.iotwatch.anomaly.rule.RuleSet;
import com.iotwatch.anomaly.rule.TelemetryField;
import com.iotwatch.anomaly.support.RecordingSinks;
import com.iotwatch.anomaly.support.TestRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.iotwatch.anomaly.support.Telemetry.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyClassifier")
class AnomalyClassifierTest {

    private final RuleSet rules = TestRules.ruleSet(3,
        TestRules.hotRule("hot", 100, Duration.ZERO),
        TestRules.rule("cold", TelemetryField.TEMPERATURE, ComparisonOperator.LT, -20, Duration.ZERO, "log"),
        TestRules.rule("wet", TelemetryField.HUMIDITY, ComparisonOperator.GTE, 95, Duration.ZERO, "log"));

    private final AnomalyClassifier classifier = new AnomalyClassifier(TestRules.registry(List.of()));

    @Test
    @DisplayName("A record matching no rule is normal")
    void normalRecord() {
        AnnotatedRecord annotated = classifier.classify(record("DEV001", 0, 21.0, 40.0), rules);

        assertFalse(annotated.isAnomaly());
        assertTrue(annotated.getMatches().isEmpty());
        assertEquals(3, annotated.ruleSetVersion());
    }

    @Test
    @DisplayName("All matching rules are recorded with the tested value")
    void multipleMatches() {
        AnnotatedRecord annotated = classifier.classify(record("DEV001", 0, 150.0, 97.0), rules);

        assertTrue(annotated.isAnomaly());
        assertEquals(List.of("hot", "wet"), List.copyOf(annotated.getMatches().keySet()));
        assertEquals(150.0, annotated.getMatches().get("hot"));
        assertEquals(97.0, annotated.getMatches().get("wet"));
    }

    @Test
    @DisplayName("Threshold boundaries follow the comparator exactly")
    void boundaries() {
        assertFalse(classifier.classify(record("DEV001", 0, 100.0, 40.0), rules).matched("hot"));
        assertTrue(classifier.classify(record("DEV001", 0, 40.0, 95.0), rules).matched("wet"));
        assertFalse(classifier.classify(record("DEV001", 0, -20.0, 40.0), rules).matched("cold"));
    }

    @Test
    @DisplayName("Without an explicit snapshot the registry's current set is used")
    void usesRegistrySnapshot() {
        RuleRegistry registry = TestRules.registry(List.of(new RecordingSinks.Channel("log")));
        registry.reload(List.of(TestRules.hotRule("hot", 100, Duration.ZERO)));
        AnomalyClassifier live = new AnomalyClassifier(registry);

        AnnotatedRecord annotated = live.classify(record("DEV001", 0, 101.0));

        assertTrue(annotated.matched("hot"));
        assertSame(registry.current(), annotated.getRuleSet());
    }
}
