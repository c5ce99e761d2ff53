package com.izapolsky.platmaps;

/**
 * Thrown from a running crawl once its {@link CancellationToken} was cancelled
 */
public class CrawlCancelledException extends RuntimeException {

    public CrawlCancelledException(String message) {
        super(message);
    }

    public CrawlCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
