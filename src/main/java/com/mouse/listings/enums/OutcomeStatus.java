package com.mouse.listings.enums;

public enum OutcomeStatus {

    /**
     * Listing page yielded asking price and location; a record was produced
     */
    ACCEPTED,

    /**
     * Auction page without a standard listing layout; nothing is persisted
     */
    AUCTION,

    /**
     * All attempts were used up without an acceptable page
     */
    FAILED;
}
