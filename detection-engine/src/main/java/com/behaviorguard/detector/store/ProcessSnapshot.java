package com.behaviorguard.detector.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a {@link ProcessRecord}, safe to hand to other threads.
 */
public record ProcessSnapshot(
        int pid,
        String image,
        String commandLine,
        String parentImage,
        Instant firstSeen,
        Instant lastActivity,
        int suspicionScore,
        List<String> tokens,
        Map<String, Integer> indicatorCounts,
        ProcessState state,
        int analysisCount) {

    public ProcessSnapshot {
        tokens = List.copyOf(tokens);
        indicatorCounts = Map.copyOf(indicatorCounts);
    }

    public int tokenCount() {
        return tokens.size();
    }

    public int indicatorCount(String indicator) {
        return indicatorCounts.getOrDefault(indicator, 0);
    }
}
