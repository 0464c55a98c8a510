package com.behaviorguard.detector.store;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable per-process behavioral state, owned exclusively by
 * {@link ProcessBehaviorStore}.
 *
 * <p>
 * All access is synchronized on the record so a snapshot never observes a
 * half-applied update. Nothing outside the store keeps a reference.
 * </p>
 */
final class ProcessRecord {

    static final int MAX_SCORE = 100;

    private final int pid;
    private final int capacity;
    private final Instant firstSeen;
    private final Deque<String> tokens;
    private final Map<String, Integer> indicatorCounts = new LinkedHashMap<>();

    private String image = "";
    private String commandLine = "";
    private String parentImage = "";
    private int suspicionScore;
    private Instant lastActivity;
    private ProcessState state = ProcessState.TRACKED;
    private int analysisCount;
    private int tokensSinceAnalysis;
    private Instant positiveAt;
    private long appends;

    ProcessRecord(int pid, int capacity, Instant firstSeen) {
        this.pid = pid;
        this.capacity = capacity;
        this.firstSeen = firstSeen;
        this.lastActivity = firstSeen;
        this.tokens = new ArrayDeque<>(Math.min(capacity, 64));
    }

    synchronized void append(String token, Instant at) {
        tokens.addLast(token);
        tokensSinceAnalysis++;
        appends++;
        while (tokens.size() > capacity) {
            tokens.removeFirst();
        }
        touch(at);
    }

    synchronized void touch(Instant at) {
        if (at != null && at.isAfter(lastActivity)) {
            lastActivity = at;
        }
    }

    synchronized void describe(String image, String commandLine, String parentImage) {
        if (image != null && !image.isEmpty()) {
            this.image = image;
        }
        if (commandLine != null && !commandLine.isEmpty()) {
            this.commandLine = commandLine;
        }
        if (parentImage != null && !parentImage.isEmpty()) {
            this.parentImage = parentImage;
        }
    }

    synchronized int adjustScore(int delta) {
        long next = (long) suspicionScore + delta;
        suspicionScore = (int) Math.max(0, Math.min(MAX_SCORE, next));
        return suspicionScore;
    }

    synchronized void countIndicator(String indicator) {
        indicatorCounts.merge(indicator, 1, Integer::sum);
    }

    synchronized boolean hasIndicator(String indicator) {
        return indicatorCounts.containsKey(indicator);
    }

    synchronized void markClear(int keepLast) {
        while (tokens.size() > keepLast) {
            tokens.removeFirst();
        }
        state = ProcessState.ANALYZED_CLEAR;
        analysisCount++;
        tokensSinceAnalysis = 0;
    }

    synchronized void markPositive(Instant at) {
        state = ProcessState.ANALYZED_POSITIVE;
        positiveAt = at;
        analysisCount++;
        tokensSinceAnalysis = 0;
    }

    synchronized int tokenCount() {
        return tokens.size();
    }

    synchronized int tokensSinceAnalysis() {
        return tokensSinceAnalysis;
    }

    synchronized ProcessState state() {
        return state;
    }

    synchronized Instant lastActivity() {
        return lastActivity;
    }

    /** Number of tokens ever appended, used to detect activity between two reads. */
    synchronized long appends() {
        return appends;
    }

    synchronized Instant positiveAt() {
        return positiveAt;
    }

    synchronized String image() {
        return image;
    }

    int pid() {
        return pid;
    }

    synchronized ProcessSnapshot snapshot() {
        return new ProcessSnapshot(
                pid, image, commandLine, parentImage, firstSeen, lastActivity,
                suspicionScore, new ArrayList<>(tokens), indicatorCounts, state, analysisCount);
    }
}
