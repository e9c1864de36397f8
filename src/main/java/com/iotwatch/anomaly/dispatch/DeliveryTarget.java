package com.iotwatch.anomaly.dispatch;

/**
 * An external destination the dispatcher delivers items to.
 *
 * Implementations may block; every call is bounded by the lane's call timeout.
 * Any exception counts as a failed attempt and is retried.
 *
 * @param <T> item type
 */
public interface DeliveryTarget<T> {

    /**
     * Unique name, used for logging, metrics and acknowledgment tracking.
     */
    String name();

    void deliver(T item) throws Exception;
}
