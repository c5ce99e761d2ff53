package com.izapolsky.platmaps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReferenceCrawlerImpl implements ReferenceCrawler {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCrawlerImpl.class);

    private final ThrottledFetcher fetcher;
    private final ReferenceScanner scanner;
    private final CrawlListener listener;
    private final CancellationToken cancellation;

    public ReferenceCrawlerImpl(MapFetcher fetcher, ReferenceScanner scanner, Throttle throttle,
                                CrawlListener listener, CancellationToken cancellation) {
        this.fetcher = new ThrottledFetcher(fetcher, throttle, listener);
        this.scanner = scanner;
        this.listener = listener;
        this.cancellation = cancellation;
    }

    @Override
    public TraversalResult crawl(MapId start) {
        String community = start.getCommunity();
        CrawlState state = new CrawlState(start);
        log.info("Starting crawl for community {} from map: {}", community, start);

        while (state.hasNext()) {
            cancellation.throwIfCancelled(String.format("traversal of %1$s", community));
            MapId current = state.poll();
            //a map may be referenced from several maps
            if (state.isSettled(current)) {
                continue;
            }
            log.info("Processing map: {} ({} completed, {} in queue)", current, state.getProcessed().size(), state.getQueueSize());

            if (!fetcher.fetch(current).isSuccess()) {
                state.markFailed(current);
            } else {
                state.markProcessed(current);
                for (MapId reference : scanner.referencesOf(current)) {
                    if (reference.sameCommunity(start) && state.offer(reference)) {
                        listener.referenceQueued(current, reference);
                    }
                }
            }
            listener.traversalProgress(community, state.getProcessed().size(), state.getFailed().size(), state.getQueueSize());
        }

        TraversalResult result = new TraversalResult(state.getProcessed(), state.getFailed());
        log.info("Community {} crawl complete! Downloaded {} maps, {} failed", community, result.getProcessedCount(), result.getFailedCount());
        if (result.getFailedCount() > 0) {
            log.warn("Failed to download from community {}: {}", community, result.getFailed());
        }
        return result;
    }
}
