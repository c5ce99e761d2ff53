package com.izapolsky.platmaps;

/**
 * Pause between requests to the origin, keeps request rate to the county server low
 */
public interface Throttle {

    Throttle NONE = () -> {
    };

    /**
     * Blocks until next request may be sent
     *
     * @throws CrawlCancelledException if interrupted while waiting
     */
    void pause();
}
