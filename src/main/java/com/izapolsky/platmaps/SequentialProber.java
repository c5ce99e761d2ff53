package com.izapolsky.platmaps;

/**
 * Brute force sweep over map sequence numbers of a community, independent of references
 */
public interface SequentialProber {
    /**
     * @param community community prefix, e.g. {@code 002}
     * @return maps found, including those stored by earlier runs
     * @throws CrawlCancelledException if cancelled while running
     */
    ProbeResult probe(String community);
}
