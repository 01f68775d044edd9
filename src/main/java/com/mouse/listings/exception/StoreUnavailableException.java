package com.mouse.listings.exception;

/**
 * The listing store could not be read or written. Fatal for the current run.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException() {
        super();
    }

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
