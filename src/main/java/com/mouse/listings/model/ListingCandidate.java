package com.mouse.listings.model;

import java.time.Instant;

/**
 * A listing reference found on an index page, before its detail page is visited.
 */
public record ListingCandidate(String title, String url, String externalId, Instant discoveredAt) {

    /**
     * Identifying key: the site's listing id when present, otherwise the url.
     */
    public String key() {
        return hasExternalId() ? externalId : url;
    }

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }
}
