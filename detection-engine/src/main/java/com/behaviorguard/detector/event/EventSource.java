package com.behaviorguard.detector.event;

import java.time.Duration;
import java.util.List;

/**
 * External producer of raw telemetry records.
 *
 * <p>
 * Delivery is best-effort: records may arrive in bursts and there is no
 * guarantee beyond the most recent records eventually arriving.
 * </p>
 */
public interface EventSource extends AutoCloseable {

    /**
     * Fetch the next batch of records, waiting at most {@code timeout} for the
     * first one.
     *
     * @param maxBatch upper bound on the returned batch size
     * @param timeout  bounded wait when nothing is pending
     * @return the batch, empty when the wait elapsed without records
     * @throws EventSourceException when the source is unreachable
     * @throws InterruptedException when the calling thread is interrupted
     */
    List<RawEvent> poll(int maxBatch, Duration timeout) throws EventSourceException, InterruptedException;

    /** Human-readable description for logs. */
    String describe();

    @Override
    default void close() {
    }
}
