package com.izapolsky.platmaps;

/**
 * Output location can't be created or written to. Nothing can be crawled in that case.
 */
public class StoreInitializationException extends RuntimeException {

    public StoreInitializationException(String message) {
        super(message);
    }

    public StoreInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
