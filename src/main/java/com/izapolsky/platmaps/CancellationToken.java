package com.izapolsky.platmaps;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a crawl, checked between fetches and phases
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * @param where what was about to happen, used in exception message
     * @throws CrawlCancelledException if cancelled
     */
    public void throwIfCancelled(String where) {
        if (isCancelled()) {
            throw new CrawlCancelledException(String.format("Crawl cancelled before %1$s", where));
        }
    }
}
