package com.behaviorguard.detector.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Pids waiting for immediate analysis, deduplicated.
 *
 * <p>
 * Filled by ingestion when an immediate indicator fires and drained by the
 * sweeper thread, so ingestion never analyzes inline.
 * </p>
 */
@Component
public class AnalysisRequestQueue {

    private final Queue<Integer> queue = new ConcurrentLinkedQueue<>();
    private final Set<Integer> pending = ConcurrentHashMap.newKeySet();

    /**
     * @return false when the pid is already queued
     */
    public boolean request(int pid) {
        if (!pending.add(pid)) {
            return false;
        }
        queue.add(pid);
        return true;
    }

    /** Remove and return everything queued, in request order. */
    public List<Integer> drain() {
        List<Integer> drained = new ArrayList<>();
        Integer pid;
        while ((pid = queue.poll()) != null) {
            pending.remove(pid);
            drained.add(pid);
        }
        return drained;
    }

    public int size() {
        return pending.size();
    }
}
