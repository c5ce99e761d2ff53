package com.izapolsky.platmaps;

/**
 * Gateway to the origin serving map documents
 */
public interface MapFetcher {

    String SC_ALREADY_STORED = "0";
    String SC_IO_ERROR = "-2";

    /**
     * Makes sure map with given id is in the store. Maps already stored are not requested again.
     * Failures are final, there are no retries.
     *
     * @param id
     * @return outcome, never null
     */
    FetchResult fetch(MapId id);
}
