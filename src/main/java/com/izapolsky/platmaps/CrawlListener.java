package com.izapolsky.platmaps;

import java.util.List;

/**
 * Receives progress of a crawl. Called synchronously from the crawling thread; implementations should
 * return quickly and must not throw.
 */
public interface CrawlListener {

    CrawlListener NONE = new CrawlListener() {
    };

    default void phaseStarted(String community, Phase phase) {
    }

    /**
     * @param found  maps found by the phase
     * @param failed maps which failed to download during the phase
     */
    default void phaseFinished(String community, Phase phase, int found, int failed) {
    }

    default void fetchAttempted(MapId id) {
    }

    default void fetchSucceeded(MapId id, FetchResult result) {
    }

    default void fetchFailed(MapId id, FetchResult result) {
    }

    /**
     * Called after every traversal step
     */
    default void traversalProgress(String community, int processed, int failed, int queued) {
    }

    default void referencesExtracted(MapId source, List<MapId> references) {
    }

    default void referenceQueued(MapId source, MapId reference) {
    }

    default void extractionFailed(MapId id, Exception cause) {
    }

    default void communityFinished(CommunityReport report) {
    }
}
