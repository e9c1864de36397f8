package com.iotwatch.anomaly.engine;

import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.AlertEvent;
import com.iotwatch.anomaly.model.AnnotatedRecord;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.rule.AlertRule;
import com.iotwatch.anomaly.rule.RuleSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RuleEngine - edge-triggered alerting with per (rule, device) cooldown.
 *
 * <h2>State machine</h2>
 * <pre>
 *   QUIET  + match, cooldown elapsed      -> fire, FIRED
 *   QUIET  + match, inside cooldown       -> suppressed, QUIET
 *   FIRED  + match, non-zero cooldown
 *            elapsed since last firing    -> fire again, FIRED
 *   FIRED  + match otherwise              -> suppressed, FIRED
 *   any    + no match                     -> QUIET
 * </pre>
 *
 * <p>Cooldown is measured in event time against the record timestamp.</p>
 *
 * <p>State is keyed by rule id, so it survives a rule reload. Pairs whose rule is gone
 * are removed the first time a record classified against a newer rule set arrives.</p>
 */
@Slf4j
public class RuleEngine {

    private static final String LOG_PREFIX = "[RULE-ENGINE]";

    private final PipelineMetrics metrics;
    private final Map<PairKey, PairState> states = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private long sweptVersion = -1;

    public RuleEngine(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Evaluate every rule of the record's snapshot and return the alerts to send.
     */
    public List<AlertEvent> evaluate(AnnotatedRecord annotated) {
        lock.lock();
        try {
            RuleSet ruleSet = annotated.getRuleSet();
            if (ruleSet.getVersion() != sweptVersion) {
                sweep(ruleSet);
            }

            TelemetryRecord record = annotated.getRecord();
            List<AlertEvent> alerts = new ArrayList<>();
            for (AlertRule rule : ruleSet.getRules()) {
                PairKey key = new PairKey(rule.getId(), record.getDeviceId());
                if (!annotated.matched(rule.getId())) {
                    PairState existing = states.get(key);
                    if (existing != null && existing.getState() == AlertState.FIRED) {
                        existing.cleared();
                        log.debug("{} {} cleared for device {}", LOG_PREFIX, rule.getId(), record.getDeviceId());
                    }
                    continue;
                }

                PairState pair = states.computeIfAbsent(key, k -> new PairState());
                if (shouldFire(pair, rule.getCooldown(), record.getTimestamp())) {
                    pair.fired(record.getTimestamp());
                    alerts.add(toAlert(rule, annotated));
                    metrics.incAlertEmitted();
                    log.info("{} ALERT rule={} device={} value={} ({})", LOG_PREFIX, rule.getId(),
                        record.getDeviceId(), annotated.getMatches().get(rule.getId()), rule.getPredicate());
                } else {
                    metrics.incSuppressed(rule.getId());
                    log.debug("{} Suppressed rule={} device={} state={} lastFiredAt={}", LOG_PREFIX,
                        rule.getId(), record.getDeviceId(), pair.getState(), pair.getLastFiredAt());
                }
            }
            return alerts;
        } finally {
            lock.unlock();
        }
    }

    public AlertState stateOf(String ruleId, String deviceId) {
        lock.lock();
        try {
            PairState pair = states.get(new PairKey(ruleId, deviceId));
            return pair == null ? AlertState.QUIET : pair.getState();
        } finally {
            lock.unlock();
        }
    }

    public int trackedPairCount() {
        lock.lock();
        try {
            return states.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean shouldFire(PairState pair, Duration cooldown, Instant at) {
        Instant last = pair.getLastFiredAt();
        boolean cooledDown = last == null || !at.isBefore(last.plus(cooldown));
        if (pair.getState() == AlertState.QUIET) {
            return cooledDown;
        }
        return !cooldown.isZero() && cooledDown;
    }

    private void sweep(RuleSet ruleSet) {
        int before = states.size();
        states.keySet().removeIf(key -> !ruleSet.contains(key.ruleId));
        int removed = before - states.size();
        if (removed > 0) {
            log.info("{} Rule set v{} active, discarded {} states of removed rules",
                LOG_PREFIX, ruleSet.getVersion(), removed);
        }
        sweptVersion = ruleSet.getVersion();
    }

    private AlertEvent toAlert(AlertRule rule, AnnotatedRecord annotated) {
        TelemetryRecord record = annotated.getRecord();
        return AlertEvent.builder()
            .id(AlertEvent.idFor(rule.getId(), record.getDeviceId(), record.getTimestamp()))
            .ruleId(rule.getId())
            .deviceId(record.getDeviceId())
            .field(rule.getPredicate().getField())
            .triggerValue(annotated.getMatches().get(rule.getId()))
            .threshold(rule.getPredicate().getThreshold())
            .timestamp(record.getTimestamp())
            .channels(List.copyOf(rule.getAction().getChannels()))
            .build();
    }

    private static final class PairKey {
        private final String ruleId;
        private final String deviceId;

        private PairKey(String ruleId, String deviceId) {
            this.ruleId = ruleId;
            this.deviceId = deviceId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof PairKey)) {
                return false;
            }
            PairKey other = (PairKey) o;
            return ruleId.equals(other.ruleId) && deviceId.equals(other.deviceId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ruleId, deviceId);
        }
    }
}
