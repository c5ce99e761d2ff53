package com.izapolsky.platmaps;

/**
 * Phases of a hybrid crawl of one community, in execution order
 */
public enum Phase {
    TRAVERSAL("reference traversal"),
    PROBE("systematic probing"),
    REFERENCE_SCAN("reference scan of probed maps"),
    ADDITIONAL_FETCH("download of additional references");

    private final String description;

    Phase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
