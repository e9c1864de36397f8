package com.iotwatch.anomaly.util;

import com.iotwatch.anomaly.metrics.PipelineMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedStageQueue")
class BoundedStageQueueTest {

    private final PipelineMetrics metrics = new PipelineMetrics();

    @Test
    @DisplayName("Full queue drops the oldest item after the offer timeout")
    void dropsOldestWhenFull() throws Exception {
        List<Integer> dropped = new ArrayList<>();
        BoundedStageQueue<Integer> queue =
            new BoundedStageQueue<>("q", 2, Duration.ofMillis(10), metrics, dropped::add);

        queue.put(1);
        queue.put(2);
        queue.put(3);

        assertEquals(List.of(1), dropped);
        assertEquals(1, queue.dropped());
        assertEquals(1L, metrics.getBackpressureDropsByQueue().get("q"));
        assertEquals(2, queue.size());
        assertEquals(2, queue.poll(Duration.ZERO));
        assertEquals(3, queue.poll(Duration.ZERO));
        assertNull(queue.poll(Duration.ZERO));
    }

    @Test
    @DisplayName("Producer waits for a consumer instead of dropping when room appears in time")
    void blocksBeforeDropping() throws Exception {
        BoundedStageQueue<String> queue = new BoundedStageQueue<>("q", 1, Duration.ofSeconds(5), metrics);
        queue.put("first");

        CountDownLatch started = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            started.countDown();
            try {
                Thread.sleep(50);
                queue.poll(Duration.ofSeconds(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        assertTrue(started.await(1, TimeUnit.SECONDS));

        queue.put("second");
        consumer.join();

        assertEquals(0, queue.dropped());
        assertEquals("second", queue.poll(Duration.ZERO));
    }

    @Test
    @DisplayName("Never holds more than its capacity under sustained overload")
    void staysBounded() throws Exception {
        BoundedStageQueue<Integer> queue = new BoundedStageQueue<>("q", 5, Duration.ZERO, metrics);
        for (int i = 0; i < 100; i++) {
            queue.put(i);
            assertTrue(queue.size() <= 5);
        }
        assertEquals(95, queue.dropped());
        assertEquals(5, queue.capacity());
    }

    @Test
    @DisplayName("Rejects a non-positive capacity")
    void rejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class,
            () -> new BoundedStageQueue<>("q", 0, Duration.ZERO, metrics));
    }
}
