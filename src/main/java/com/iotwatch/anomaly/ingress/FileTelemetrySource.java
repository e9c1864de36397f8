package com.iotwatch.anomaly.ingress;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays a JSON-lines file, one telemetry entry per line.
 *
 * The cursor is the line number on partition 0. Reaching the end of the file is not
 * an error: the source keeps the file open and picks up appended lines (tail mode).
 */
@Slf4j
public class FileTelemetrySource implements TelemetrySource {

    private static final String LOG_PREFIX = "[INGRESS-FILE]";
    private static final int PARTITION = 0;

    private final Path path;
    private final int maxBatch;
    private BufferedReader reader;
    private long nextLine;

    public FileTelemetrySource(Path path, int maxBatch) {
        this.path = path;
        this.maxBatch = maxBatch;
    }

    @Override
    public void connect(IngressCursor from) throws TransportException {
        long skip = from.nextOffset(PARTITION).orElse(0L);
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
            nextLine = 0;
            while (nextLine < skip && reader.readLine() != null) {
                nextLine++;
            }
            log.info("{} Opened {} at line {}", LOG_PREFIX, path, nextLine);
        } catch (IOException e) {
            closeQuietly();
            throw new TransportException("Cannot open " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<SourceEntry> poll(Duration timeout) throws TransportException {
        if (reader == null) {
            throw new TransportException("Source for " + path + " is not connected");
        }
        List<SourceEntry> entries = new ArrayList<>();
        try {
            String line;
            while (entries.size() < maxBatch && (line = reader.readLine()) != null) {
                long offset = nextLine++;
                if (!line.isBlank()) {
                    entries.add(new SourceEntry(PARTITION, offset, line));
                }
            }
        } catch (IOException e) {
            throw new TransportException("Read from " + path + " failed: " + e.getMessage(), e);
        }
        if (entries.isEmpty()) {
            sleep(timeout);
        }
        return entries;
    }

    @Override
    public String describe() {
        return "file:" + path;
    }

    @Override
    public void close() {
        closeQuietly();
    }

    private void closeQuietly() {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("{} Error closing {}: {}", LOG_PREFIX, path, e.getMessage());
        } finally {
            reader = null;
        }
    }

    private static void sleep(Duration timeout) {
        try {
            Thread.sleep(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
