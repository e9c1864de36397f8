package com.iotwatch.anomaly.retry;

import lombok.Getter;

/**
 * Thrown when an operation still fails after its last permitted attempt.
 * The cause is the failure of that last attempt.
 */
@Getter
public class RetryExhaustedException extends RuntimeException {

    private final String operationName;
    private final int attempts;

    public RetryExhaustedException(String operationName, int attempts, Throwable cause) {
        super(String.format("Operation '%s' failed after %d attempts", operationName, attempts), cause);
        this.operationName = operationName;
        this.attempts = attempts;
    }
}
