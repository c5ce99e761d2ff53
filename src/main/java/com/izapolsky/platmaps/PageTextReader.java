package com.izapolsky.platmaps;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Reads text out of a stored map document
 */
public interface PageTextReader {
    /**
     * @param document stored artifact
     * @return text of each page, in page order
     * @throws IOException if the document is missing, malformed or unreadable
     */
    List<String> readPages(File document) throws IOException;
}
