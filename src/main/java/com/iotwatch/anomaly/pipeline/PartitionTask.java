package com.iotwatch.anomaly.pipeline;

import com.iotwatch.anomaly.model.TelemetryRecord;

/**
 * Unit of work in a partition queue: a record to process, or a request to flush idle devices.
 */
final class PartitionTask {

    enum Kind { RECORD, IDLE_FLUSH }

    private final Kind kind;
    private final TelemetryRecord record;
    private final long wallClockMillis;

    private PartitionTask(Kind kind, TelemetryRecord record, long wallClockMillis) {
        this.kind = kind;
        this.record = record;
        this.wallClockMillis = wallClockMillis;
    }

    static PartitionTask record(TelemetryRecord record, long arrivalMillis) {
        return new PartitionTask(Kind.RECORD, record, arrivalMillis);
    }

    static PartitionTask idleFlush(long nowMillis) {
        return new PartitionTask(Kind.IDLE_FLUSH, null, nowMillis);
    }

    Kind getKind() {
        return kind;
    }

    TelemetryRecord getRecord() {
        return record;
    }

    long getWallClockMillis() {
        return wallClockMillis;
    }
}
