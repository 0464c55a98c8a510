package com.behaviorguard.detector.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Termination budget and quarantine audit trail.
 *
 * <p>
 * {@link #tryAcquire()} spends one slot of a one-minute sliding budget; once
 * the budget is used up no further process is terminated until the oldest
 * slot ages out. {@link #record} writes one audit line per quarantine decision
 * and keeps a running count per {@link TerminationOutcome}.
 * </p>
 */
@Component
public class ActionTracker {

    private static final Logger log = LoggerFactory.getLogger(ActionTracker.class);

    private static final Duration WINDOW = Duration.ofMinutes(1);

    @Value("${behaviorguard.response.quarantine.rate-limit-per-minute:10}")
    private int rateLimitPerMinute;

    private final Clock clock;

    private final Deque<Instant> spent = new ArrayDeque<>();
    private final Map<TerminationOutcome, Integer> outcomes = new EnumMap<>(TerminationOutcome.class);

    public ActionTracker() {
        this(Clock.systemUTC());
    }

    ActionTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Spend one termination slot.
     *
     * @return false when the budget for the current minute is exhausted
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        expire(now);
        if (spent.size() >= rateLimitPerMinute) {
            return false;
        }
        spent.addLast(now);
        return true;
    }

    private void expire(Instant now) {
        Instant windowStart = now.minus(WINDOW);
        while (!spent.isEmpty() && !spent.peekFirst().isAfter(windowStart)) {
            spent.pollFirst();
        }
    }

    /** Audit one quarantine decision. */
    public synchronized void record(int pid, String image, String label, TerminationOutcome outcome) {
        int count = outcomes.merge(outcome, 1, Integer::sum);
        log.info("QUARANTINE_AUDIT: outcome={} (#{}) pid={} image={} label={}",
                outcome.tag(), count, pid, image, label != null ? label : "unknown");
    }

    public synchronized int countOf(TerminationOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public synchronized int getTotalActions() {
        return outcomes.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Slots spent in the last minute. */
    public synchronized int slotsInUse() {
        expire(clock.instant());
        return spent.size();
    }

    public int getRateLimitPerMinute() {
        return rateLimitPerMinute;
    }
}
