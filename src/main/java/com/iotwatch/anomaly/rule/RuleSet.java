package com.iotwatch.anomaly.rule;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned snapshot of the active alert rules.
 *
 * Readers hold on to one snapshot for the whole evaluation of a record; a reload
 * publishes a new instance and never touches an existing one.
 */
public final class RuleSet {

    private final long version;
    private final Instant loadedAt;
    private final List<AlertRule> rules;
    private final Map<String, AlertRule> byId;

    public RuleSet(long version, Instant loadedAt, List<AlertRule> rules) {
        this.version = version;
        this.loadedAt = loadedAt;
        this.rules = List.copyOf(rules);
        Map<String, AlertRule> index = new LinkedHashMap<>();
        for (AlertRule rule : this.rules) {
            index.put(rule.getId(), rule);
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    public static RuleSet empty() {
        return new RuleSet(0, Instant.EPOCH, List.of());
    }

    public long getVersion() {
        return version;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public List<AlertRule> getRules() {
        return rules;
    }

    public boolean contains(String ruleId) {
        return byId.containsKey(ruleId);
    }

    public Optional<AlertRule> find(String ruleId) {
        return Optional.ofNullable(byId.get(ruleId));
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleSet{version=" + version + ", rules=" + byId.keySet() + "}";
    }
}
