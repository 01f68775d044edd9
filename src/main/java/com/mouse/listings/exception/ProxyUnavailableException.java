package com.mouse.listings.exception;

/**
 * No egress proxy could be obtained from the proxy directory after the configured attempts.
 */
public class ProxyUnavailableException extends RuntimeException {
    public ProxyUnavailableException() {
        super();
    }

    public ProxyUnavailableException(String message) {
        super(message);
    }

    public ProxyUnavailableException(String message, Throwable e) {
        super(message, e);
    }
}
