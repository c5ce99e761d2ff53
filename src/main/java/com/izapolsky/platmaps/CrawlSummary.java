package com.izapolsky.platmaps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Multiset;

import java.util.List;
import java.util.SortedMap;

/**
 * Outcome of a crawl over several communities
 */
public final class CrawlSummary {

    private final List<CommunityReport> reports;
    private final SortedMap<String, Integer> storedByCommunity;
    private final boolean cancelled;

    public CrawlSummary(List<CommunityReport> reports, Multiset<String> storedCommunities, boolean cancelled) {
        this.reports = ImmutableList.copyOf(reports);
        ImmutableSortedMap.Builder<String, Integer> stored = ImmutableSortedMap.naturalOrder();
        for (Multiset.Entry<String> entry : storedCommunities.entrySet()) {
            stored.put(entry.getElement(), entry.getCount());
        }
        this.storedByCommunity = stored.build();
        this.cancelled = cancelled;
    }

    /**
     * Reports of communities crawled, in seed order
     */
    public List<CommunityReport> getReports() {
        return reports;
    }

    public int getTotalFound() {
        return reports.stream().mapToInt(CommunityReport::getTotalFound).sum();
    }

    public int getTotalFailed() {
        return reports.stream().mapToInt(CommunityReport::getTotalFailed).sum();
    }

    /**
     * Maps present in the store after the crawl, by community prefix
     */
    public SortedMap<String, Integer> getStoredByCommunity() {
        return storedByCommunity;
    }

    public int getTotalStored() {
        return storedByCommunity.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
