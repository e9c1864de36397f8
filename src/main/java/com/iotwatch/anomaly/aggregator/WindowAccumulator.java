package com.iotwatch.anomaly.aggregator;

import com.iotwatch.anomaly.model.FieldStats;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.model.WindowSnapshot;

import java.time.Instant;

/**
 * Mutable accumulator of one open window of one device.
 *
 * Owned by a single {@link WindowAggregator}; converted to an immutable
 * {@link WindowSnapshot} exactly once, when the window closes.
 */
class WindowAccumulator {

    private final String deviceId;
    private final Instant windowStart;
    private final Instant windowEnd;

    private long count;
    private String location;
    private final Stats temperature = new Stats();
    private final Stats humidity = new Stats();

    WindowAccumulator(String deviceId, Instant windowStart, Instant windowEnd) {
        this.deviceId = deviceId;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
    }

    void add(TelemetryRecord record) {
        count++;
        temperature.add(record.getTemperature());
        humidity.add(record.getHumidity());
        location = record.getLocation();
    }

    Instant getWindowStart() {
        return windowStart;
    }

    Instant getWindowEnd() {
        return windowEnd;
    }

    long getCount() {
        return count;
    }

    WindowSnapshot toSnapshot() {
        return WindowSnapshot.builder()
            .id(WindowSnapshot.idFor(deviceId, windowStart))
            .deviceId(deviceId)
            .location(location)
            .windowStart(windowStart)
            .windowEnd(windowEnd)
            .count(count)
            .temperature(temperature.toFieldStats(count))
            .humidity(humidity.toFieldStats(count))
            .build();
    }

    private static final class Stats {
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private double sum;

        void add(double value) {
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }

        FieldStats toFieldStats(long count) {
            return FieldStats.builder()
                .min(min)
                .max(max)
                .sum(sum)
                .mean(count > 0 ? sum / count : 0.0)
                .build();
        }
    }
}
