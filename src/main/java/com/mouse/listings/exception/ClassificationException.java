package com.mouse.listings.exception;

public class ClassificationException extends RuntimeException {
    public ClassificationException() {
        super();
    }

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable e) {
        super(message, e);
    }
}
