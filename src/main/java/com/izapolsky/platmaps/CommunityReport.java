package com.izapolsky.platmaps;

/**
 * Numbers of a hybrid crawl of one community.
 * <p>
 * Totals add up phases as they are: a map found by traversal and found again by probing is counted twice.
 * Use {@link CrawlSummary#getStoredByCommunity()} for the number of distinct stored maps.
 */
public final class CommunityReport {

    private final String community;
    private final int traversalProcessed;
    private final int traversalFailed;
    private final int probeDiscovered;
    private final int probeMisses;
    private final int additionalProcessed;
    private final int additionalFailed;

    public CommunityReport(String community, int traversalProcessed, int traversalFailed, int probeDiscovered,
                           int probeMisses, int additionalProcessed, int additionalFailed) {
        this.community = community;
        this.traversalProcessed = traversalProcessed;
        this.traversalFailed = traversalFailed;
        this.probeDiscovered = probeDiscovered;
        this.probeMisses = probeMisses;
        this.additionalProcessed = additionalProcessed;
        this.additionalFailed = additionalFailed;
    }

    public String getCommunity() {
        return community;
    }

    public int getTraversalProcessed() {
        return traversalProcessed;
    }

    public int getTraversalFailed() {
        return traversalFailed;
    }

    public int getProbeDiscovered() {
        return probeDiscovered;
    }

    /**
     * Probe misses are expected at the tail of each sweep and are not part of {@link #getTotalFailed()}
     */
    public int getProbeMisses() {
        return probeMisses;
    }

    public int getAdditionalProcessed() {
        return additionalProcessed;
    }

    public int getAdditionalFailed() {
        return additionalFailed;
    }

    public int getTotalFound() {
        return traversalProcessed + probeDiscovered + additionalProcessed;
    }

    public int getTotalFailed() {
        return traversalFailed + additionalFailed;
    }

    @Override
    public String toString() {
        return String.format("CommunityReport{community=%1$s, found=%2$s, failed=%3$s}", community, getTotalFound(), getTotalFailed());
    }
}
