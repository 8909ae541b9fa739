package com.tabledesigner.store;

/**
 * Raised by {@link DesignStore} when the design database cannot be read or written.
 */
public class DesignStoreException extends RuntimeException {
    public DesignStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
