package com.izapolsky.platmaps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Crawls one community in four phases: reference traversal from a starting map, systematic probing,
 * reference scan of probed maps and download of references the first two phases missed.
 */
public class HybridCrawler {

    private static final Logger log = LoggerFactory.getLogger(HybridCrawler.class);

    private final MapStore store;
    private final ReferenceCrawler crawler;
    private final SequentialProber prober;
    private final ReferenceScanner scanner;
    private final ThrottledFetcher fetcher;
    private final CrawlListener listener;
    private final CancellationToken cancellation;

    public HybridCrawler(MapStore store, ReferenceCrawler crawler, SequentialProber prober, ReferenceScanner scanner,
                         MapFetcher fetcher, Throttle throttle, CrawlListener listener, CancellationToken cancellation) {
        this.store = store;
        this.crawler = crawler;
        this.prober = prober;
        this.scanner = scanner;
        this.fetcher = new ThrottledFetcher(fetcher, throttle, listener);
        this.listener = listener;
        this.cancellation = cancellation;
    }

    public CommunityReport crawlCommunity(MapId start) {
        String community = start.getCommunity();
        log.info("Starting hybrid crawl for community {}", community);

        listener.phaseStarted(community, Phase.TRAVERSAL);
        TraversalResult traversal = crawler.crawl(start);
        listener.phaseFinished(community, Phase.TRAVERSAL, traversal.getProcessedCount(), traversal.getFailedCount());

        cancellation.throwIfCancelled(Phase.PROBE.getDescription());
        listener.phaseStarted(community, Phase.PROBE);
        ProbeResult probe = prober.probe(community);
        listener.phaseFinished(community, Phase.PROBE, probe.getDiscovered().size(), probe.getMisses());

        cancellation.throwIfCancelled(Phase.REFERENCE_SCAN.getDescription());
        listener.phaseStarted(community, Phase.REFERENCE_SCAN);
        SortedSet<MapId> missing = missingReferences(start, probe.getDiscovered());
        listener.phaseFinished(community, Phase.REFERENCE_SCAN, missing.size(), 0);

        listener.phaseStarted(community, Phase.ADDITIONAL_FETCH);
        int additionalProcessed = 0;
        int additionalFailed = 0;
        for (MapId reference : missing) {
            cancellation.throwIfCancelled(String.format("download of %1$s", reference));
            log.info("Downloading additional reference: {}", reference);
            if (fetcher.fetch(reference).isSuccess()) {
                additionalProcessed++;
            } else {
                additionalFailed++;
            }
        }
        listener.phaseFinished(community, Phase.ADDITIONAL_FETCH, additionalProcessed, additionalFailed);

        CommunityReport report = new CommunityReport(community, traversal.getProcessedCount(), traversal.getFailedCount(),
                probe.getDiscovered().size(), probe.getMisses(), additionalProcessed, additionalFailed);
        listener.communityFinished(report);
        return report;
    }

    /**
     * References of given maps which belong to the community of {@code start} and aren't stored yet
     */
    protected SortedSet<MapId> missingReferences(MapId start, SortedSet<MapId> maps) {
        SortedSet<MapId> result = new TreeSet<>();
        for (MapId map : maps) {
            if (!store.contains(map)) {
                continue;
            }
            for (MapId reference : scanner.referencesOf(map)) {
                if (reference.sameCommunity(start) && !store.contains(reference)) {
                    result.add(reference);
                }
            }
        }
        return result;
    }
}
