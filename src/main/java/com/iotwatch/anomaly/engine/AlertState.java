package com.iotwatch.anomaly.engine;

/**
 * Per (rule, device) alert state.
 */
public enum AlertState {
    /** Condition not active; the next match may fire. */
    QUIET,
    /** Alert sent and the condition still holds. */
    FIRED
}
