package com.iotwatch.anomaly.pipeline;

/**
 * Maps a device to the partition that owns its window and alert state.
 */
public class DevicePartitioner {

    private final int partitions;

    public DevicePartitioner(int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("Partition count must be at least 1: " + partitions);
        }
        this.partitions = partitions;
    }

    public int partitionOf(String deviceId) {
        return Math.floorMod(deviceId.hashCode(), partitions);
    }

    public int getPartitions() {
        return partitions;
    }
}
