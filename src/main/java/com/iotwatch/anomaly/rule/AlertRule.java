package com.iotwatch.anomaly.rule;

import com.iotwatch.anomaly.model.TelemetryRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * User-defined alert rule. Immutable; a change is a new {@link RuleSet}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertRule {

    String id;
    RulePredicate predicate;
    RuleAction action;

    /**
     * Minimum time between two alerts of this rule for the same device.
     */
    @Builder.Default
    Duration cooldown = Duration.ZERO;

    public boolean matches(TelemetryRecord record) {
        return predicate.matches(record);
    }
}
