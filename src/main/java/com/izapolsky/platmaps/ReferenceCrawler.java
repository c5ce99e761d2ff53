package com.izapolsky.platmaps;

/**
 * Breadth first traversal of maps of one community, following references found in downloaded maps
 */
public interface ReferenceCrawler {
    /**
     * @param start first map to download, its community bounds the traversal
     * @return maps processed and failed
     * @throws CrawlCancelledException if cancelled while running
     */
    TraversalResult crawl(MapId start);
}
