package com.izapolsky.platmaps;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;
import java.util.SortedSet;

public final class ProbeResult {

    private final String community;
    private final ImmutableSortedSet<MapId> discovered;
    private final int attempts;
    private final int misses;
    private final boolean stoppedEarly;

    public ProbeResult(String community, Collection<MapId> discovered, int attempts, int misses, boolean stoppedEarly) {
        this.community = community;
        this.discovered = ImmutableSortedSet.copyOf(discovered);
        this.attempts = attempts;
        this.misses = misses;
        this.stoppedEarly = stoppedEarly;
    }

    public String getCommunity() {
        return community;
    }

    public SortedSet<MapId> getDiscovered() {
        return discovered;
    }

    /**
     * @return number of fetches sent, stored maps are not fetched
     */
    public int getAttempts() {
        return attempts;
    }

    public int getMisses() {
        return misses;
    }

    /**
     * @return true if sweep ended on consecutive failure cutoff rather than on the attempt limit
     */
    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    @Override
    public String toString() {
        return String.format("ProbeResult{community=%1$s, discovered=%2$s, attempts=%3$s, misses=%4$s, stoppedEarly=%5$s}",
                community, discovered, attempts, misses, stoppedEarly);
    }
}
