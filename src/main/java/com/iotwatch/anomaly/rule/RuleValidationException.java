package com.iotwatch.anomaly.rule;

import lombok.Getter;

import java.util.List;

/**
 * A candidate rule set was rejected. The previously active set remains in effect.
 */
@Getter
public class RuleValidationException extends RuntimeException {

    private final List<String> errors;

    public RuleValidationException(List<String> errors) {
        super("Rule set rejected: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public RuleValidationException(String error, Throwable cause) {
        super("Rule set rejected: " + error, cause);
        this.errors = List.of(error);
    }
}
