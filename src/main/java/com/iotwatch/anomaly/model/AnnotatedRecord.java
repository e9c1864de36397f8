package com.iotwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.iotwatch.anomaly.rule.RuleSet;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A telemetry record together with its classification.
 *
 * Carries the exact rule-set snapshot it was classified against, so downstream
 * rule evaluation of the same record sees the same rules even if a reload
 * happens in between.
 */
@Value
public class AnnotatedRecord {

    TelemetryRecord record;

    @JsonIgnore
    RuleSet ruleSet;

    /**
     * Matching rule id -> value of the predicate's field.
     */
    Map<String, Double> matches;

    public AnnotatedRecord(TelemetryRecord record, RuleSet ruleSet, Map<String, Double> matches) {
        this.record = record;
        this.ruleSet = ruleSet;
        this.matches = Collections.unmodifiableMap(new LinkedHashMap<>(matches));
    }

    public boolean isAnomaly() {
        return !matches.isEmpty();
    }

    public boolean matched(String ruleId) {
        return matches.containsKey(ruleId);
    }

    public String recordId() {
        return record.recordId();
    }

    public long ruleSetVersion() {
        return ruleSet.getVersion();
    }
}
