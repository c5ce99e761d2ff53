package com.izapolsky.platmaps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.TreeMultiset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the hybrid crawl for each known community of the county and totals the results
 */
public class CountyCrawler {

    private static final Logger log = LoggerFactory.getLogger(CountyCrawler.class);

    /**
     * Starting maps of Goldfield, Silverpeak, Gold Point, Lida (004 and 006) and Dyer
     */
    public static final List<MapId> DEFAULT_SEEDS = ImmutableList.of(
            MapId.parse("001-01"),
            MapId.parse("002-01"),
            MapId.parse("003-01"),
            MapId.parse("004-01"),
            MapId.parse("006-01"),
            MapId.parse("007-01"));

    private final MapStore store;
    private final HybridCrawler hybridCrawler;
    private final CancellationToken cancellation;

    public CountyCrawler(MapStore store, HybridCrawler hybridCrawler, CancellationToken cancellation) {
        this.store = store;
        this.hybridCrawler = hybridCrawler;
        this.cancellation = cancellation;
    }

    /**
     * Crawls community of each seed, starting from the seed. A cancelled crawl is summarized with the
     * communities completed so far.
     *
     * @param seeds
     * @return
     */
    public CrawlSummary crawlAll(List<MapId> seeds) {
        log.info("Starting multi-community crawl of {} communities", seeds.size());
        List<CommunityReport> reports = new ArrayList<>(seeds.size());
        boolean cancelled = false;
        try {
            for (MapId seed : seeds) {
                cancellation.throwIfCancelled(String.format("community %1$s", seed.getCommunity()));
                log.info("Starting crawl for community {} from map: {}", seed.getCommunity(), seed);
                CommunityReport report = hybridCrawler.crawlCommunity(seed);
                reports.add(report);
                log.info("Completed community {}: {} maps downloaded, {} failed", report.getCommunity(), report.getTotalFound(), report.getTotalFailed());
            }
        } catch (CrawlCancelledException e) {
            log.warn("{}, summarizing {} completed communities", e.getMessage(), reports.size());
            cancelled = true;
        }

        CrawlSummary summary = summarize(reports, cancelled);
        log.info("All communities complete! Total: {} maps downloaded, {} failed", summary.getTotalFound(), summary.getTotalFailed());
        return summary;
    }

    protected CrawlSummary summarize(List<CommunityReport> reports, boolean cancelled) {
        TreeMultiset<String> storedCommunities = TreeMultiset.create();
        for (MapId id : store.list()) {
            storedCommunities.add(id.getCommunity());
        }
        log.info("Total maps in output directory: {}", storedCommunities.size());
        return new CrawlSummary(reports, storedCommunities, cancelled);
    }
}
