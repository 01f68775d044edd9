package com.mouse.listings.model;

import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.enums.OutcomeStatus;

/**
 * Terminal result of one candidate's attempt sequence.
 */
public record ScrapeOutcome(OutcomeStatus status,
                            ListingCandidate candidate,
                            ListingRecord record,
                            ListingPageData pageData,
                            String reason,
                            int attempts,
                            int resets) {

    public static ScrapeOutcome accepted(ListingCandidate candidate, ListingRecord record, int attempts, int resets) {
        return new ScrapeOutcome(OutcomeStatus.ACCEPTED, candidate, record, null, "OK", attempts, resets);
    }

    public static ScrapeOutcome auction(ListingCandidate candidate, ListingPageData pageData, int attempts, int resets) {
        return new ScrapeOutcome(OutcomeStatus.AUCTION, candidate, null, pageData, "auction listing", attempts, resets);
    }

    public static ScrapeOutcome failed(ListingCandidate candidate, String reason, int attempts, int resets) {
        return new ScrapeOutcome(OutcomeStatus.FAILED, candidate, null, null, reason, attempts, resets);
    }

    public boolean isAccepted() {
        return status == OutcomeStatus.ACCEPTED;
    }
}
