package com.behaviorguard.detector.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-memory event source for embedding the engine behind another
 * collector. When the queue is full new records are rejected and counted
 * rather than blocking the producer.
 */
public class QueueEventSource implements EventSource {

    private static final Logger log = LoggerFactory.getLogger(QueueEventSource.class);

    private final BlockingQueue<RawEvent> queue;
    private final AtomicLong rejected = new AtomicLong();

    public QueueEventSource(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Offer a record without blocking.
     *
     * @return false when the queue is full and the record was dropped
     */
    public boolean offer(RawEvent event) {
        boolean accepted = queue.offer(event);
        if (!accepted) {
            long count = rejected.incrementAndGet();
            if (count % 1000 == 1) {
                log.warn("Event queue full, {} records rejected so far", count);
            }
        }
        return accepted;
    }

    @Override
    public List<RawEvent> poll(int maxBatch, Duration timeout) throws InterruptedException {
        List<RawEvent> batch = new ArrayList<>();
        RawEvent first = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return batch;
        }
        batch.add(first);
        queue.drainTo(batch, maxBatch - 1);
        return batch;
    }

    public int pending() {
        return queue.size();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    @Override
    public String describe() {
        return "in-memory queue (capacity=" + (queue.size() + queue.remainingCapacity()) + ")";
    }
}
