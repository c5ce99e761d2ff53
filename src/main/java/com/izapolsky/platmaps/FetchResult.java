package com.izapolsky.platmaps;

import org.apache.http.HttpStatus;

/**
 * Outcome of a single {@link MapFetcher#fetch(MapId)}
 */
public final class FetchResult {

    private static final FetchResult STORED = new FetchResult(true, true, MapFetcher.SC_ALREADY_STORED);

    private final boolean success;
    private final boolean fromStore;
    private final String status;

    private FetchResult(boolean success, boolean fromStore, String status) {
        this.success = success;
        this.fromStore = fromStore;
        this.status = status;
    }

    public static FetchResult stored() {
        return STORED;
    }

    public static FetchResult downloaded() {
        return new FetchResult(true, false, String.valueOf(HttpStatus.SC_OK));
    }

    public static FetchResult failed(String status) {
        return new FetchResult(false, false, status);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return true if the map was already stored and the origin wasn't contacted
     */
    public boolean isFromStore() {
        return fromStore;
    }

    /**
     * HTTP status code as string, or one of the negative codes of {@link MapFetcher}
     */
    public String getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return String.format("FetchResult{success=%1$s, fromStore=%2$s, status=%3$s}", success, fromStore, status);
    }
}
