package com.iotwatch.anomaly.ingress;

import lombok.Value;

/**
 * Raw entry as delivered by a transport, with its position.
 */
@Value
public class SourceEntry {

    int partition;
    long offset;
    String payload;
}
