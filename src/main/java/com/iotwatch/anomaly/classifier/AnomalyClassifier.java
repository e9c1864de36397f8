package com.iotwatch.anomaly.classifier;

import com.iotwatch.anomaly.model.AnnotatedRecord;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.rule.AlertRule;
import com.iotwatch.anomaly.rule.RuleRegistry;
import com.iotwatch.anomaly.rule.RuleSet;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Marks records that match at least one threshold rule.
 *
 * Stateless: every rule of the snapshot is evaluated and all matches are kept.
 */
@Component
public class AnomalyClassifier {

    private final RuleRegistry registry;

    public AnomalyClassifier(RuleRegistry registry) {
        this.registry = registry;
    }

    public AnnotatedRecord classify(TelemetryRecord record) {
        return classify(record, registry.current());
    }

    public AnnotatedRecord classify(TelemetryRecord record, RuleSet ruleSet) {
        Map<String, Double> matches = new LinkedHashMap<>();
        for (AlertRule rule : ruleSet.getRules()) {
            if (rule.matches(record)) {
                matches.put(rule.getId(), rule.getPredicate().valueOf(record));
            }
        }
        return new AnnotatedRecord(record, ruleSet, matches);
    }
}
