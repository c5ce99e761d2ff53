package com.izapolsky.platmaps;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * State of one traversal: maps downloaded and scanned, maps which failed, and FIFO frontier of maps
 * to visit. A map is in at most one of the three.
 */
public class CrawlState {

    private final Set<MapId> processed = new LinkedHashSet<>();
    private final Set<MapId> failed = new LinkedHashSet<>();
    private final Deque<MapId> frontier = new ArrayDeque<>();
    //membership index of frontier
    private final Set<MapId> queued = new HashSet<>();

    public CrawlState(MapId start) {
        offer(start);
    }

    /**
     * Enqueues map unless it's processed, failed or already queued
     *
     * @param id
     * @return true if map was added to frontier
     */
    public boolean offer(MapId id) {
        if (isSettled(id) || !queued.add(id)) {
            return false;
        }
        frontier.addLast(id);
        return true;
    }

    public boolean hasNext() {
        return !frontier.isEmpty();
    }

    /**
     * @return head of frontier, null if it's empty
     */
    public MapId poll() {
        MapId next = frontier.pollFirst();
        if (next != null) {
            queued.remove(next);
        }
        return next;
    }

    public boolean isSettled(MapId id) {
        return processed.contains(id) || failed.contains(id);
    }

    public boolean isQueued(MapId id) {
        return queued.contains(id);
    }

    public void markProcessed(MapId id) {
        Preconditions.checkState(!failed.contains(id), "%s already failed", id);
        processed.add(id);
    }

    public void markFailed(MapId id) {
        Preconditions.checkState(!processed.contains(id), "%s already processed", id);
        failed.add(id);
    }

    public Set<MapId> getProcessed() {
        return Collections.unmodifiableSet(processed);
    }

    public Set<MapId> getFailed() {
        return Collections.unmodifiableSet(failed);
    }

    public int getQueueSize() {
        return frontier.size();
    }
}
