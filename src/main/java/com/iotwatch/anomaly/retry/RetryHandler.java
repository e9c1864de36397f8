package com.iotwatch.anomaly.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retry handler with exponential backoff.
 *
 * Used by the ingress adapter for transport reconnects and by every sink
 * delivery lane. Interruption aborts the retry loop immediately.
 */
@Component
@Slf4j
public class RetryHandler {

    /**
     * Execute operation with the default policy
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(operation, operationName, RetryPolicy.defaults());
    }

    /**
     * Execute operation with custom retry count and default backoff
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName, int maxAttempts) {
        RetryPolicy defaults = RetryPolicy.defaults();
        return executeWithRetry(operation, operationName, RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .initialDelay(defaults.getInitialDelay())
            .multiplier(defaults.getMultiplier())
            .maxDelay(defaults.getMaxDelay())
            .build());
    }

    /**
     * Execute operation with an explicit policy.
     *
     * @throws RetryExhaustedException when the last attempt fails
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName, RetryPolicy policy) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        int attempt = 0;
        RuntimeException lastException = null;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                attempt++;

                if (attempt >= maxAttempts) {
                    log.error("[RETRY] Operation '{}' failed after {} attempts: {}",
                        operationName, maxAttempts, e.getMessage());
                    break;
                }

                long delayMs = policy.backoffMillis(attempt);
                log.warn("[RETRY] Operation '{}' failed (attempt {}/{}). Retrying in {}ms. Error: {}",
                    operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operationName, attempt, ie);
                }
            }
        }

        throw new RetryExhaustedException(operationName, attempt, lastException);
    }

    /**
     * Execute operation with retry logic (void return)
     */
    public void executeWithRetry(Runnable operation, String operationName, RetryPolicy policy) {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, operationName, policy);
    }
}
