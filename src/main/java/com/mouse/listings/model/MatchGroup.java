package com.mouse.listings.model;

import com.mouse.listings.entity.ListingRecord;

import java.util.List;
import java.util.Set;

/**
 * Subscribers sharing exactly the same matched listings. One campaign is sent per group.
 */
public record MatchGroup(String groupKey, Set<String> subscriberEmails, List<ListingRecord> listings) {
}
