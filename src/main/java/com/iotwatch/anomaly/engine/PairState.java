package com.iotwatch.anomaly.engine;

import java.time.Instant;

/**
 * Mutable state of one (rule, device) pair. Only touched by the owning engine.
 */
final class PairState {

    private AlertState state = AlertState.QUIET;
    private Instant lastFiredAt;

    AlertState getState() {
        return state;
    }

    Instant getLastFiredAt() {
        return lastFiredAt;
    }

    void fired(Instant at) {
        state = AlertState.FIRED;
        lastFiredAt = at;
    }

    void cleared() {
        state = AlertState.QUIET;
    }
}
