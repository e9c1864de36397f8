package com.iotwatch.anomaly.ingress;

import lombok.Getter;

/**
 * Terminal ingress failure: the transport could not be recovered within the retry budget.
 * The only failure that stops the pipeline.
 */
@Getter
public class IngressFailureException extends RuntimeException {

    private final IngressCursor lastPosition;

    public IngressFailureException(String message, IngressCursor lastPosition, Throwable cause) {
        super(message, cause);
        this.lastPosition = lastPosition;
    }
}
