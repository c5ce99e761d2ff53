package com.izapolsky.platmaps;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.SortedSet;

/**
 * Storage of downloaded maps, keyed by canonical map id. Presence of a map is the only record
 * of it having been downloaded.
 */
public interface MapStore {

    boolean contains(MapId id);

    /**
     * Location of the artifact for given id, whether it exists or not
     *
     * @param id
     * @return
     */
    File locate(MapId id);

    /**
     * Stores content for given id. A partially written artifact is never visible under its final name.
     *
     * @param id
     * @param content
     * @return stored file
     * @throws IOException
     */
    File write(MapId id, InputStream content) throws IOException;

    /**
     * Writes informational properties next to the artifact
     *
     * @param id
     * @param metadata
     */
    void writeMetadata(MapId id, Properties metadata);

    /**
     * @param id
     * @return properties written for given id, empty if there are none
     */
    Properties readMetadata(MapId id);

    /**
     * Lists every stored map
     *
     * @return
     */
    SortedSet<MapId> list();
}
