package com.izapolsky.platmaps;

/**
 * Single fetch as done by every phase: reported to listener, followed by a pause whenever the origin was contacted
 */
final class ThrottledFetcher {

    private final MapFetcher fetcher;
    private final Throttle throttle;
    private final CrawlListener listener;

    ThrottledFetcher(MapFetcher fetcher, Throttle throttle, CrawlListener listener) {
        this.fetcher = fetcher;
        this.throttle = throttle;
        this.listener = listener;
    }

    FetchResult fetch(MapId id) {
        listener.fetchAttempted(id);
        FetchResult result = fetcher.fetch(id);
        if (result.isSuccess()) {
            listener.fetchSucceeded(id, result);
        } else {
            listener.fetchFailed(id, result);
        }
        if (!result.isFromStore()) {
            throttle.pause();
        }
        return result;
    }
}
