package com.izapolsky.platmaps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes crawl progress to the log
 */
public class LoggingCrawlListener implements CrawlListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingCrawlListener.class);

    @Override
    public void phaseStarted(String community, Phase phase) {
        log.info("Phase {}: {} for {}", phase.ordinal() + 1, phase.getDescription(), community);
    }

    @Override
    public void phaseFinished(String community, Phase phase, int found, int failed) {
        log.info("Phase {} complete for {}: {} found, {} failed", phase.ordinal() + 1, community, found, failed);
    }

    @Override
    public void fetchAttempted(MapId id) {
        log.debug("Fetching {}", id);
    }

    @Override
    public void fetchSucceeded(MapId id, FetchResult result) {
        log.debug("Fetched {} ({})", id, result.isFromStore() ? "stored" : "downloaded");
    }

    @Override
    public void fetchFailed(MapId id, FetchResult result) {
        log.warn("Failed to fetch {}, status {}", id, result.getStatus());
    }

    @Override
    public void traversalProgress(String community, int processed, int failed, int queued) {
        log.info("Queue size: {}, Processed: {}, Failed: {}", queued, processed, failed);
    }

    @Override
    public void referencesExtracted(MapId source, List<MapId> references) {
        log.info("Found {} potential references in {}: {}", references.size(), source, references);
    }

    @Override
    public void referenceQueued(MapId source, MapId reference) {
        log.debug("Added {} from {} to download queue", reference, source);
    }

    @Override
    public void extractionFailed(MapId id, Exception cause) {
        log.error("Failed to extract references from {}: {}", id, cause.toString());
    }

    @Override
    public void communityFinished(CommunityReport report) {
        log.info("Hybrid crawl complete for {}: traversal {} found, systematic {} found, additional {} found, total {} maps, {} failed",
                report.getCommunity(), report.getTraversalProcessed(), report.getProbeDiscovered(),
                report.getAdditionalProcessed(), report.getTotalFound(), report.getTotalFailed());
    }
}
