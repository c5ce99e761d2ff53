package com.izapolsky.platmaps;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;
import java.util.SortedSet;

/**
 * Final state of a finished traversal
 */
public final class TraversalResult {

    private final ImmutableSortedSet<MapId> processed;
    private final ImmutableSortedSet<MapId> failed;

    public TraversalResult(Collection<MapId> processed, Collection<MapId> failed) {
        this.processed = ImmutableSortedSet.copyOf(processed);
        this.failed = ImmutableSortedSet.copyOf(failed);
    }

    public SortedSet<MapId> getProcessed() {
        return processed;
    }

    public SortedSet<MapId> getFailed() {
        return failed;
    }

    public int getProcessedCount() {
        return processed.size();
    }

    public int getFailedCount() {
        return failed.size();
    }

    @Override
    public String toString() {
        return String.format("TraversalResult{processed=%1$s, failed=%2$s}", processed, failed);
    }
}
