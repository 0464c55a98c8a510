package com.behaviorguard.detector.store;

import com.behaviorguard.detector.config.EngineConfig;
import com.behaviorguard.detector.config.HeuristicsConfig;
import com.behaviorguard.detector.detection.IndicatorHit;
import com.behaviorguard.detector.event.BehaviorEvent;
import com.behaviorguard.detector.event.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of all per-process behavioral state, keyed by pid.
 *
 * <p>
 * Operations are atomic per pid: creation, replacement and eviction go through
 * {@link ConcurrentHashMap#compute}, and every record mutation is synchronized
 * on the record itself. Operations on different pids never share a lock.
 * Other components only ever see {@link ProcessSnapshot} copies.
 * </p>
 */
@Component
public class ProcessBehaviorStore {

    private static final Logger log = LoggerFactory.getLogger(ProcessBehaviorStore.class);

    private final Map<Integer, ProcessRecord> records = new ConcurrentHashMap<>();

    private final EngineConfig config;
    private final HeuristicsConfig heuristics;
    private final BehaviorTokenizer tokenizer;
    private final ProcessLiveness liveness;
    private final Clock clock;

    private final AtomicLong processesTracked = new AtomicLong();

    @Autowired
    public ProcessBehaviorStore(
            EngineConfig config,
            HeuristicsConfig heuristics,
            BehaviorTokenizer tokenizer,
            ProcessLiveness liveness) {
        this(config, heuristics, tokenizer, liveness, Clock.systemUTC());
    }

    public ProcessBehaviorStore(
            EngineConfig config,
            HeuristicsConfig heuristics,
            BehaviorTokenizer tokenizer,
            ProcessLiveness liveness,
            Clock clock) {
        this.config = config;
        this.heuristics = heuristics;
        this.tokenizer = tokenizer;
        this.liveness = liveness;
        this.clock = clock;
    }

    /**
     * Record one normalized event.
     *
     * <p>
     * Events from whitelisted images are discarded. A process-creation event for
     * a pid that already has a record means the pid was reused, so the old
     * record is replaced by a fresh one.
     * </p>
     *
     * @return true when the event was recorded, false when it was discarded
     */
    public boolean recordEvent(BehaviorEvent event) {
        String image = event.image();
        ProcessRecord known = records.get(event.pid());
        String effectiveImage = image.isEmpty() && known != null ? known.image() : image;
        if (heuristics.isWhitelisted(effectiveImage)) {
            return false;
        }

        String token = tokenizer.tokenFor(event);
        Instant now = clock.instant();
        boolean reuse = event.kind() == EventKind.PROCESS_CREATE;

        records.compute(event.pid(), (pid, existing) -> {
            ProcessRecord record = existing;
            if (record == null || reuse) {
                if (record != null) {
                    log.debug("pid={} reused by a new process, discarding previous record", pid);
                }
                record = newRecord(pid, now);
            }
            record.describe(image,
                    event.attribute(BehaviorEvent.COMMAND_LINE),
                    event.attribute(BehaviorEvent.PARENT_IMAGE));
            record.append(token, now);
            return record;
        });
        return true;
    }

    /**
     * Append pre-tokenized API-call telemetry for a process, creating the record
     * if needed.
     *
     * @return true when recorded, false for whitelisted images or empty input
     */
    public boolean appendTokens(int pid, String image, List<String> tokens) {
        if (tokens == null || tokens.isEmpty() || heuristics.isWhitelisted(image)) {
            return false;
        }
        Instant now = clock.instant();
        records.compute(pid, (k, existing) -> {
            ProcessRecord record = existing != null ? existing : newRecord(k, now);
            record.describe(image, null, null);
            for (String token : tokens) {
                if (token != null && !token.isBlank()) {
                    record.append(token.trim(), now);
                }
            }
            return record;
        });
        return true;
    }

    private ProcessRecord newRecord(int pid, Instant now) {
        processesTracked.incrementAndGet();
        return new ProcessRecord(pid, config.getBufferCapacity(), now);
    }

    /**
     * Add {@code delta} to the suspicion score, clamped to [0, 100].
     *
     * @return the new score, or empty when the pid is not tracked
     */
    public OptionalInt adjustScore(int pid, int delta) {
        ProcessRecord record = records.get(pid);
        if (record == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(record.adjustScore(delta));
    }

    /**
     * Apply indicator hits: every delta is added (clamped) and each indicator's
     * occurrence count is incremented.
     *
     * @return the new score, or empty when the pid is not tracked
     */
    public OptionalInt applyIndicators(int pid, List<IndicatorHit> hits) {
        ProcessRecord record = records.get(pid);
        if (record == null) {
            return OptionalInt.empty();
        }
        synchronized (record) {
            int score = record.adjustScore(0);
            for (IndicatorHit hit : hits) {
                record.countIndicator(hit.indicator().key());
                score = record.adjustScore(hit.delta());
            }
            return OptionalInt.of(score);
        }
    }

    /** True when the record already raised the given indicator. */
    public boolean hasIndicator(int pid, String indicatorKey) {
        ProcessRecord record = records.get(pid);
        return record != null && record.hasIndicator(indicatorKey);
    }

    public Optional<ProcessSnapshot> snapshot(int pid) {
        ProcessRecord record = records.get(pid);
        return record == null ? Optional.empty() : Optional.of(record.snapshot());
    }

    /** Remove the record. Idempotent. */
    public boolean evict(int pid) {
        return records.remove(pid) != null;
    }

    public boolean contains(int pid) {
        return records.containsKey(pid);
    }

    public int size() {
        return records.size();
    }

    public long getProcessesTracked() {
        return processesTracked.get();
    }

    /**
     * Evict processes that no longer exist or have been idle longer than the
     * window. Records awaiting post-detection eviction are left to
     * {@link #evictExpiredPositives(Instant, Duration)}.
     *
     * @return number of evicted records
     */
    public int evictStale(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        int evicted = 0;
        for (ProcessRecord record : records.values()) {
            if (record.state() == ProcessState.ANALYZED_POSITIVE) {
                continue;
            }
            long appends = record.appends();
            if ((record.lastActivity().isBefore(cutoff) || !liveness.isAlive(record.pid()))
                    && removeIfUnchanged(record, appends, false)) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Evict detected processes whose audit grace period has expired.
     *
     * @return number of evicted records
     */
    public int evictExpiredPositives(Instant now, Duration grace) {
        Instant cutoff = now.minus(grace);
        int evicted = 0;
        for (ProcessRecord record : records.values()) {
            long appends = record.appends();
            Instant positiveAt = record.positiveAt();
            if (record.state() == ProcessState.ANALYZED_POSITIVE && positiveAt != null
                    && !positiveAt.isAfter(cutoff)
                    && removeIfUnchanged(record, appends, true)) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Remove {@code observed} only if it is still the pid's record, received no
     * token since {@code appends} was read, and is still detected exactly when
     * {@code positive}. A replaced or freshly active record survives.
     */
    private boolean removeIfUnchanged(ProcessRecord observed, long appends, boolean positive) {
        AtomicBoolean removed = new AtomicBoolean();
        records.computeIfPresent(observed.pid(), (pid, current) -> {
            if (current != observed || current.appends() != appends
                    || (current.state() == ProcessState.ANALYZED_POSITIVE) != positive) {
                log.debug("pid={} changed since it was selected for eviction, keeping it", pid);
                return current;
            }
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    /**
     * Tracked or previously cleared processes with at least {@code minTokens}
     * buffered tokens and new activity since their last analysis.
     */
    public List<Integer> eligibleForSweep(int minTokens) {
        List<Integer> eligible = new ArrayList<>();
        for (ProcessRecord record : records.values()) {
            synchronized (record) {
                if (record.state() != ProcessState.ANALYZED_POSITIVE
                        && record.tokenCount() >= minTokens
                        && record.tokensSinceAnalysis() > 0) {
                    eligible.add(record.pid());
                }
            }
        }
        return eligible;
    }

    /** Clear verdict: keep only the last {@code keepLast} tokens and resume tracking. */
    public void markClear(int pid, int keepLast) {
        records.computeIfPresent(pid, (k, record) -> {
            record.markClear(keepLast);
            return record;
        });
    }

    /** Positive verdict: retain the record for audit until the grace period expires. */
    public void markPositive(int pid) {
        Instant now = clock.instant();
        records.computeIfPresent(pid, (k, record) -> {
            record.markPositive(now);
            return record;
        });
    }

    /**
     * Lower the score of every cleared process by {@code amount}.
     *
     * @return number of records whose score changed
     */
    public int decayScores(int amount) {
        if (amount <= 0) {
            return 0;
        }
        int decayed = 0;
        for (ProcessRecord record : records.values()) {
            synchronized (record) {
                if (record.state() != ProcessState.ANALYZED_CLEAR) {
                    continue;
                }
                int before = record.adjustScore(0);
                if (before > 0) {
                    record.adjustScore(-amount);
                    decayed++;
                }
            }
        }
        return decayed;
    }

    public Instant now() {
        return clock.instant();
    }
}
