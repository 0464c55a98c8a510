package com.behaviorguard.detector.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tails a newline-delimited JSON spool file written by an external telemetry
 * forwarder.
 *
 * <p>
 * Each line is one {@link RawEvent}:
 * </p>
 *
 * <pre>
 * {"eventId":8,"timeCreated":"2024-05-01T10:00:00Z","computer":"WS-01","fields":["", "...", "", "4242", ...]}
 * </pre>
 *
 * <p>
 * Only complete lines are consumed; a trailing partial line is left for the
 * next poll. A line longer than {@value #MAX_CHUNK} bytes is counted as
 * malformed and skipped up to its terminating newline. When the file shrinks
 * (rotation or truncation) reading restarts at offset zero. A missing file is
 * reported as source unavailability.
 * </p>
 */
public class SpoolFileEventSource implements EventSource {

    private static final Logger log = LoggerFactory.getLogger(SpoolFileEventSource.class);

    /** Upper bound on bytes read per poll, and on the length of a usable line. */
    static final int MAX_CHUNK = 1 << 20;

    /** Sleep between checks while waiting for new lines. */
    private static final long WAIT_STEP_MS = 50;

    private final Path path;
    private final ObjectMapper objectMapper;

    private long position;
    private long malformedLines;
    private boolean discardingLine;

    public SpoolFileEventSource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RawEvent> poll(int maxBatch, Duration timeout) throws EventSourceException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            List<RawEvent> batch = readAvailable(maxBatch);
            if (!batch.isEmpty() || System.nanoTime() >= deadline) {
                return batch;
            }
            Thread.sleep(WAIT_STEP_MS);
        }
    }

    private List<RawEvent> readAvailable(int maxBatch) throws EventSourceException {
        if (!Files.exists(path)) {
            throw new EventSourceException("Spool file not found: " + path);
        }

        List<RawEvent> batch = new ArrayList<>();
        try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r")) {
            long length = raf.length();
            if (length < position) {
                log.info("Spool file {} shrank from {} to {} bytes, restarting from the beginning",
                        path, position, length);
                position = 0;
                discardingLine = false;
            }
            if (length == position) {
                return batch;
            }

            int toRead = (int) Math.min(MAX_CHUNK, length - position);
            byte[] chunk = new byte[toRead];
            raf.seek(position);
            raf.readFully(chunk);

            int lineStart = 0;
            if (discardingLine) {
                int newline = indexOfNewline(chunk);
                if (newline < 0) {
                    position += chunk.length;
                    return batch;
                }
                discardingLine = false;
                lineStart = newline + 1;
            }
            for (int i = lineStart; i < chunk.length && batch.size() < maxBatch; i++) {
                if (chunk[i] != '\n') {
                    continue;
                }
                String line = new String(chunk, lineStart, i - lineStart, StandardCharsets.UTF_8).trim();
                lineStart = i + 1;
                if (!line.isEmpty()) {
                    parseLine(line, batch);
                }
            }
            if (lineStart == 0 && chunk.length == MAX_CHUNK) {
                malformedLines++;
                discardingLine = true;
                lineStart = chunk.length;
                log.warn("Spool line at offset {} in {} exceeds {} bytes, discarding it", position, path, MAX_CHUNK);
            }
            position += lineStart;

        } catch (IOException e) {
            throw new EventSourceException("Failed to read spool file " + path, e);
        }
        return batch;
    }

    private static int indexOfNewline(byte[] chunk) {
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] == '\n') {
                return i;
            }
        }
        return -1;
    }

    private void parseLine(String line, List<RawEvent> batch) {
        try {
            batch.add(objectMapper.readValue(line, RawEvent.class));
        } catch (JsonProcessingException e) {
            malformedLines++;
            log.debug("Skipping malformed spool line at offset {}: {}", position, e.getOriginalMessage());
        }
    }

    public long getPosition() {
        return position;
    }

    public long getMalformedLines() {
        return malformedLines;
    }

    @Override
    public String describe() {
        return "spool file " + path;
    }
}
