package com.mouse.listings.detector;

import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.model.MatchGroup;
import com.mouse.listings.utils.GroupKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups subscribers whose matched listings are the same set, keyed by the sorted listing ids.
 */
@Component
public class SubscriberGrouper {

    public List<MatchGroup> group(Map<String, List<ListingRecord>> matches) {
        Map<List<String>, Set<String>> emailsBySet = new LinkedHashMap<>();
        Map<List<String>, List<ListingRecord>> listingsBySet = new LinkedHashMap<>();

        matches.forEach((email, listings) -> {
            if (listings == null || listings.isEmpty()) {
                return;
            }
            List<String> ids = GroupKeys.sortedIds(listings.stream().map(ListingRecord::key).toList());
            emailsBySet.computeIfAbsent(ids, k -> new LinkedHashSet<>()).add(email);
            listingsBySet.putIfAbsent(ids, listings);
        });

        List<MatchGroup> groups = new ArrayList<>();
        emailsBySet.forEach((ids, emails) ->
                groups.add(new MatchGroup(GroupKeys.groupKey(ids), emails, listingsBySet.get(ids))));
        return groups;
    }
}
