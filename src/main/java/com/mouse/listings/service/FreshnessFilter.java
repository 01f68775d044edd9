package com.mouse.listings.service;

import com.mouse.listings.model.KnownListingKeys;
import com.mouse.listings.model.ListingCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class FreshnessFilter {

    private final ListingStore listingStore;

    /**
     * Candidates whose key is not stored yet, duplicates collapsed, discovery order kept.
     * Store failures propagate.
     */
    public List<ListingCandidate> filter(Collection<ListingCandidate> candidates) {
        Map<String, ListingCandidate> unique = new LinkedHashMap<>();
        for (ListingCandidate candidate : candidates) {
            if (candidate.key() != null) {
                unique.putIfAbsent(candidate.key(), candidate);
            }
        }
        if (unique.isEmpty()) {
            return List.of();
        }

        KnownListingKeys known = listingStore.findExistingKeys(
                unique.values().stream().filter(ListingCandidate::hasExternalId).map(ListingCandidate::externalId).toList(),
                unique.values().stream().map(ListingCandidate::url).filter(Objects::nonNull).toList());

        List<ListingCandidate> fresh = unique.values().stream()
                .filter(c -> !known.contains(c))
                .toList();
        log.info("Freshness filter | Candidates: {} | Unique: {} | Fresh: {}",
                candidates.size(), unique.size(), fresh.size());
        return fresh;
    }
}
