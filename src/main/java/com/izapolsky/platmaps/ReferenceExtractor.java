package com.izapolsky.platmaps;

import java.util.List;

/**
 * Finds ids of other maps that a plat map refers to, given the text of its pages
 */
public interface ReferenceExtractor {
    /**
     * Extracts references of a single map document.
     *
     * @param pageTexts text of each page, in page order
     * @param selfId    id of the document the text belongs to
     * @return sorted, duplicate free ids of the same community as {@code selfId}, never containing {@code selfId}
     */
    List<MapId> extractReferences(List<String> pageTexts, MapId selfId);
}
