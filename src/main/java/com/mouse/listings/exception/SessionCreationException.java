package com.mouse.listings.exception;

public class SessionCreationException extends RuntimeException {
    public SessionCreationException() {
        super();
    }

    public SessionCreationException(String message) {
        super(message);
    }

    public SessionCreationException(String message, Throwable e) {
        super(message, e);
    }
}
