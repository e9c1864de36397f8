package com.iotwatch.anomaly.controller;

import com.iotwatch.anomaly.dispatch.DeadLetterQueue;
import com.iotwatch.anomaly.dispatch.SinkDispatcher;
import com.iotwatch.anomaly.model.DeadLetter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/dead-letters")
@Slf4j
public class DeadLetterController {

    private final DeadLetterQueue deadLetters;
    private final SinkDispatcher dispatcher;

    public DeadLetterController(DeadLetterQueue deadLetters, SinkDispatcher dispatcher) {
        this.deadLetters = deadLetters;
        this.dispatcher = dispatcher;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        List<DeadLetter> entries = deadLetters.list();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", entries.size());
        body.put("capacity", deadLetters.capacity());
        body.put("entries", entries);
        return ResponseEntity.ok(body);
    }

    /**
     * Send every dead letter back through its sink lane.
     */
    @PostMapping("/replay")
    public ResponseEntity<Map<String, Object>> replay() {
        try {
            int replayed = dispatcher.replayDeadLetters();
            log.info("[DLQ] Replay requested, {} items re-queued", replayed);
            return ResponseEntity.ok(Map.of("replayed", replayed, "remaining", deadLetters.size()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(503).body(Map.of("error", "replay interrupted"));
        }
    }
}
