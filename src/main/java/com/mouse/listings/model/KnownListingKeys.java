package com.mouse.listings.model;

import java.util.Set;

/**
 * Identifiers already present in the listing store.
 */
public record KnownListingKeys(Set<String> externalIds, Set<String> urls) {

    public static KnownListingKeys none() {
        return new KnownListingKeys(Set.of(), Set.of());
    }

    public boolean contains(ListingCandidate candidate) {
        if (candidate.hasExternalId() && externalIds.contains(candidate.externalId())) {
            return true;
        }
        return candidate.url() != null && urls.contains(candidate.url());
    }
}
