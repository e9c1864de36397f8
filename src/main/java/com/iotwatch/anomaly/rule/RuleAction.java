package com.iotwatch.anomaly.rule;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Notification channels an alert of the rule is fanned out to.
 */
@Value
@Builder
@Jacksonized
public class RuleAction {

    @Singular
    List<String> channels;
}
