package com.iotwatch.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Count-free statistics of one numeric field over a window.
 * The owning {@link WindowSnapshot} carries the count.
 */
@Value
@Builder
@Jacksonized
public class FieldStats {

    double min;
    double max;
    double sum;
    double mean;
}
