package com.iotwatch.anomaly.aggregator;

import com.iotwatch.anomaly.metrics.PipelineMetrics;
import com.iotwatch.anomaly.model.TelemetryRecord;
import com.iotwatch.anomaly.model.WindowSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * WindowAggregator - per-device tumbling windows closed by an event-time watermark.
 *
 * <h2>Window assignment</h2>
 * <p>{@code windowStart = floor(timestamp / size) * size}; the window covers
 * {@code [windowStart, windowStart + size)} and is created on its first record.</p>
 *
 * <h2>Closure</h2>
 * <ul>
 *   <li>Watermark: the largest timestamp seen for the device.</li>
 *   <li>A window is emitted once {@code windowEnd + grace} is strictly before the watermark.</li>
 *   <li>Idle flush: a device silent for {@code idleTimeout} (wall clock) has all its open
 *       windows emitted.</li>
 * </ul>
 *
 * <h2>Late data</h2>
 * <p>A record older than {@code watermark - grace}, or falling before a window that was
 * already emitted for its device, is dropped and counted. Emitted windows are never
 * updated.</p>
 *
 * <p>One instance is owned by one partition worker. The lock only guards the rare
 * cross-thread calls (stats, final flush at shutdown).</p>
 */
@Slf4j
public class WindowAggregator {

    private static final String LOG_PREFIX = "[WINDOW-AGG]";

    private final long sizeMs;
    private final long graceMs;
    private final long idleTimeoutMs;
    private final long stateRetentionMs;
    private final PipelineMetrics metrics;

    private final Map<String, DeviceWindows> devices = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public WindowAggregator(Duration size, Duration grace, Duration idleTimeout, Duration stateRetention,
                            PipelineMetrics metrics) {
        if (size.isZero() || size.isNegative()) {
            throw new IllegalArgumentException("Window size must be positive: " + size);
        }
        if (grace.isNegative()) {
            throw new IllegalArgumentException("Grace period must not be negative: " + grace);
        }
        this.sizeMs = size.toMillis();
        this.graceMs = grace.toMillis();
        this.idleTimeoutMs = idleTimeout.toMillis();
        this.stateRetentionMs = Math.max(stateRetention.toMillis(), idleTimeout.toMillis());
        this.metrics = metrics;
    }

    /**
     * Add a record and return the windows it closed, oldest first.
     */
    public List<WindowSnapshot> ingest(TelemetryRecord record) {
        return ingest(record, System.currentTimeMillis());
    }

    /**
     * @param arrivalMillis wall-clock arrival time, used only for idle detection
     */
    public List<WindowSnapshot> ingest(TelemetryRecord record, long arrivalMillis) {
        lock.lock();
        try {
            long ts = record.getTimestamp().toEpochMilli();
            DeviceWindows device = devices.computeIfAbsent(record.getDeviceId(), DeviceWindows::new);
            device.lastArrivalMillis = arrivalMillis;

            if (device.isLate(ts, graceMs)) {
                metrics.incLateDropped();
                log.debug("{} Dropped late record device={} ts={} watermark={} closedBefore={}",
                    LOG_PREFIX, record.getDeviceId(), record.getTimestamp(),
                    Instant.ofEpochMilli(device.watermark), Instant.ofEpochMilli(device.closedBefore));
                return Collections.emptyList();
            }

            long windowStart = Math.floorDiv(ts, sizeMs) * sizeMs;
            device.open.computeIfAbsent(windowStart, start -> new WindowAccumulator(
                device.deviceId, Instant.ofEpochMilli(start), Instant.ofEpochMilli(start + sizeMs)))
                .add(record);

            device.watermark = Math.max(device.watermark, ts);
            return closeExpired(device);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emit every open window of devices silent for at least the idle timeout, and forget
     * devices silent for longer than the state retention.
     */
    public List<WindowSnapshot> flushIdle(long nowMillis) {
        lock.lock();
        try {
            List<WindowSnapshot> emitted = new ArrayList<>();
            Iterator<DeviceWindows> it = devices.values().iterator();
            while (it.hasNext()) {
                DeviceWindows device = it.next();
                long silentFor = nowMillis - device.lastArrivalMillis;
                if (!device.open.isEmpty() && silentFor >= idleTimeoutMs) {
                    List<WindowSnapshot> flushed = closeAll(device);
                    metrics.incIdleFlush();
                    log.info("{} [IDLE-FLUSH] device={} silent for {}ms, emitted {} windows",
                        LOG_PREFIX, device.deviceId, silentFor, flushed.size());
                    emitted.addAll(flushed);
                }
                if (device.open.isEmpty() && silentFor >= stateRetentionMs) {
                    it.remove();
                }
            }
            return emitted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emit every open window regardless of watermark. Used at shutdown.
     */
    public List<WindowSnapshot> flushAll() {
        lock.lock();
        try {
            List<WindowSnapshot> emitted = new ArrayList<>();
            for (DeviceWindows device : devices.values()) {
                emitted.addAll(closeAll(device));
            }
            if (!emitted.isEmpty()) {
                log.info("{} Final flush emitted {} windows", LOG_PREFIX, emitted.size());
            }
            return emitted;
        } finally {
            lock.unlock();
        }
    }

    public int openWindowCount() {
        lock.lock();
        try {
            return devices.values().stream().mapToInt(d -> d.open.size()).sum();
        } finally {
            lock.unlock();
        }
    }

    public int trackedDeviceCount() {
        lock.lock();
        try {
            return devices.size();
        } finally {
            lock.unlock();
        }
    }

    private List<WindowSnapshot> closeExpired(DeviceWindows device) {
        List<WindowSnapshot> emitted = new ArrayList<>();
        Iterator<Map.Entry<Long, WindowAccumulator>> it = device.open.entrySet().iterator();
        while (it.hasNext()) {
            WindowAccumulator acc = it.next().getValue();
            long windowEnd = acc.getWindowEnd().toEpochMilli();
            if (windowEnd + graceMs >= device.watermark) {
                break;
            }
            it.remove();
            device.closedBefore = Math.max(device.closedBefore, windowEnd);
            emitted.add(acc.toSnapshot());
        }
        metrics.incWindowsEmitted(emitted.size());
        return emitted;
    }

    private List<WindowSnapshot> closeAll(DeviceWindows device) {
        List<WindowSnapshot> emitted = new ArrayList<>(device.open.size());
        for (WindowAccumulator acc : device.open.values()) {
            device.closedBefore = Math.max(device.closedBefore, acc.getWindowEnd().toEpochMilli());
            emitted.add(acc.toSnapshot());
        }
        device.open.clear();
        metrics.incWindowsEmitted(emitted.size());
        return emitted;
    }

    /**
     * Event-time clock and open windows of one device.
     */
    private static final class DeviceWindows {
        private final String deviceId;
        private final TreeMap<Long, WindowAccumulator> open = new TreeMap<>();
        private long watermark = Long.MIN_VALUE;
        private long closedBefore = Long.MIN_VALUE;
        private long lastArrivalMillis;

        private DeviceWindows(String deviceId) {
            this.deviceId = deviceId;
        }

        private boolean isLate(long ts, long graceMs) {
            if (ts < closedBefore) {
                return true;
            }
            return watermark != Long.MIN_VALUE && ts < watermark - graceMs;
        }
    }
}
