package com.izapolsky.platmaps;

import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.util.List;

/**
 * Reads a stored map and extracts its references. A map that can't be read has no references.
 */
public class ReferenceScanner {

    private final MapStore store;
    private final PageTextReader reader;
    private final ReferenceExtractor extractor;
    private final CrawlListener listener;

    public ReferenceScanner(MapStore store, PageTextReader reader, ReferenceExtractor extractor, CrawlListener listener) {
        this.store = store;
        this.reader = reader;
        this.extractor = extractor;
        this.listener = listener;
    }

    public List<MapId> referencesOf(MapId id) {
        List<String> pages;
        try {
            pages = reader.readPages(store.locate(id));
        } catch (IOException | RuntimeException e) {
            //PDFBox reports some malformed documents with unchecked exceptions
            listener.extractionFailed(id, e);
            return ImmutableList.of();
        }
        List<MapId> references = extractor.extractReferences(pages, id);
        listener.referencesExtracted(id, references);
        return references;
    }
}
