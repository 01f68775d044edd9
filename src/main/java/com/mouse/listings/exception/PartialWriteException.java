package com.mouse.listings.exception;

import lombok.Getter;

/**
 * A bulk write that stored part of the batch. {@code persisted} documents are in the
 * store, {@code rejected} write operations failed.
 */
@Getter
public class PartialWriteException extends StoreUnavailableException {

    private final int persisted;
    private final int rejected;

    public PartialWriteException(String message, int persisted, int rejected, Throwable e) {
        super(message, e);
        this.persisted = persisted;
        this.rejected = rejected;
    }
}
