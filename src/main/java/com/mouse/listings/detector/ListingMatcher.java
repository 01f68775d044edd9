package com.mouse.listings.detector;

import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.model.SubscriberProfile;
import com.mouse.listings.utils.PriceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which listings a subscriber wants. A listing matches only when every
 * constraint the subscriber set holds; an unset constraint never excludes anything.
 */
@Slf4j
@Component
public class ListingMatcher {

    /**
     * @return email to matched listings in batch order; subscribers without email or without matches are left out
     */
    public Map<String, List<ListingRecord>> matchAll(List<SubscriberProfile> subscribers, List<ListingRecord> listings) {
        Map<String, List<ListingRecord>> matches = new LinkedHashMap<>();
        for (SubscriberProfile subscriber : subscribers) {
            String email = subscriber.getEmail();
            if (email == null || email.isBlank()) {
                continue;
            }
            List<ListingRecord> matched = new ArrayList<>();
            for (ListingRecord listing : listings) {
                if (matches(subscriber, listing)) {
                    matched.add(listing);
                }
            }
            if (!matched.isEmpty()) {
                matches.put(email, matched);
            }
        }
        log.info("Matching done | Subscribers: {} | Listings: {} | Matched subscribers: {}",
                subscribers.size(), listings.size(), matches.size());
        return matches;
    }

    public boolean matches(SubscriberProfile subscriber, ListingRecord listing) {
        return priceInRange(subscriber, listing)
                && industryMatches(subscriber.getIndustries(), listing.getCategory())
                && contains(subscriber.getStates(), listing.getState())
                && contains(subscriber.getCities(), listing.getCity());
    }

    private boolean priceInRange(SubscriberProfile subscriber, ListingRecord listing) {
        Optional<BigDecimal> price = PriceParser.parse(listing.getAskingPrice());
        if (price.isEmpty()) {
            return true;
        }
        BigDecimal min = subscriber.getMinPrice();
        BigDecimal max = subscriber.getMaxPrice();
        if (min != null && price.get().compareTo(min) < 0) {
            return false;
        }
        return max == null || price.get().compareTo(max) <= 0;
    }

    private boolean industryMatches(Set<String> industries, List<String> categories) {
        if (industries == null || industries.isEmpty()) {
            return true;
        }
        if (categories == null) {
            return false;
        }
        Set<String> wanted = normalize(industries);
        return categories.stream()
                .map(ListingMatcher::normalize)
                .filter(Objects::nonNull)
                .anyMatch(wanted::contains);
    }

    private boolean contains(Set<String> wanted, String value) {
        if (wanted == null || wanted.isEmpty()) {
            return true;
        }
        String normalized = normalize(value);
        return normalized != null && normalize(wanted).contains(normalized);
    }

    private static Set<String> normalize(Set<String> values) {
        return values.stream()
                .map(ListingMatcher::normalize)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    /** Trimmed and lower-cased; blank becomes null. */
    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
