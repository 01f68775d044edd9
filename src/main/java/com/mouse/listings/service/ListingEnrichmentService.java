package com.mouse.listings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.enums.ListingCategory;
import com.mouse.listings.interfaces.ClassificationService;
import com.mouse.listings.model.ListingPageData;
import com.mouse.listings.model.LocationInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes category and location through the classifier. Never fails the caller:
 * category falls back to the raw value and location to a split on the last comma.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ListingEnrichmentService {

    static final String CATEGORY_SYSTEM_PROMPT = "You are a business categorization expert. "
            + "Return only valid JSON with the 'category' key containing an array of categories.";
    static final String LOCATION_SYSTEM_PROMPT = "You are a location extraction expert.";

    private final ClassificationService classificationService;

    public ListingRecord enrich(ListingPageData data) {
        List<String> categories = categorize(data.getRawCategory());
        LocationInfo location = extractLocation(data.getLocation());

        return ListingRecord.builder()
                .id(ListingRecord.keyOf(data.getExternalId(), data.getUrl()))
                .externalId(data.getExternalId())
                .url(data.getUrl())
                .title(data.getTitle())
                .askingPrice(data.getAskingPrice())
                .grossRevenue(data.getGrossRevenue())
                .established(data.getEstablished())
                .cashflow(data.getCashflow())
                .description(data.getDescription())
                .category(categories)
                .originalCategory(data.getRawCategory())
                .location(data.getLocation())
                .city(location.city())
                .state(location.state())
                .brokerName(data.getBrokerName())
                .brokerProfileUrl(data.getBrokerProfileUrl())
                .brokerPhone(data.getBrokerPhone())
                .scrapedAt(Instant.now())
                .build();
    }

    public List<String> categorize(String rawCategory) {
        if (rawCategory == null || rawCategory.isBlank()) {
            return new ArrayList<>();
        }
        if (!classificationService.isEnabled()) {
            return new ArrayList<>(List.of(rawCategory));
        }

        try {
            JsonNode reply = classificationService.completeJson(CATEGORY_SYSTEM_PROMPT, categoryPrompt(rawCategory));
            Set<String> valid = new LinkedHashSet<>();
            for (JsonNode value : reply.path("category")) {
                ListingCategory.fromLabel(value.asText()).ifPresent(c -> valid.add(c.getLabel()));
            }
            if (valid.isEmpty()) {
                log.warn("No valid categories in classifier reply | Raw: {} | Reply: {}", rawCategory, reply);
                return new ArrayList<>(List.of(rawCategory));
            }
            log.debug("Categorized | Raw: {} | Categories: {}", rawCategory, valid);
            return new ArrayList<>(valid);
        } catch (RuntimeException e) {
            log.warn("Categorization failed, keeping raw category | Raw: {} | Reason: {}", rawCategory, e.getMessage());
            return new ArrayList<>(List.of(rawCategory));
        }
    }

    public LocationInfo extractLocation(String rawLocation) {
        if (rawLocation == null || rawLocation.isBlank()) {
            return LocationInfo.empty();
        }
        if (!classificationService.isEnabled()) {
            return splitLocation(rawLocation);
        }

        try {
            JsonNode reply = classificationService.completeJson(LOCATION_SYSTEM_PROMPT, locationPrompt(rawLocation));
            String city = lower(reply.path("city").asText(null));
            String state = lower(reply.path("state").asText(null));
            if (city == null && state == null) {
                return splitLocation(rawLocation);
            }
            return new LocationInfo(city, state);
        } catch (RuntimeException e) {
            log.warn("Location extraction failed, splitting raw value | Raw: {} | Reason: {}", rawLocation, e.getMessage());
            return splitLocation(rawLocation);
        }
    }

    /**
     * {@code "Las Vegas, NV"} becomes city {@code "las vegas"} and state {@code "nv"}.
     */
    static LocationInfo splitLocation(String rawLocation) {
        int comma = rawLocation.lastIndexOf(',');
        if (comma < 0) {
            return new LocationInfo(lower(rawLocation), null);
        }
        return new LocationInfo(lower(rawLocation.substring(0, comma)), lower(rawLocation.substring(comma + 1)));
    }

    private static String categoryPrompt(String rawCategory) {
        return """
                Analyze this business listing category and categorize it using ONLY the predefined categories below.
                You can select multiple categories if applicable. Return ONLY a JSON response with the key "category" and value as an array of selected categories.

                Predefined categories:
                %s

                Business listing category:
                Original Category: %s

                Return ONLY a JSON response like this:
                {"category": ["Category1", "Category2"]}
                """.formatted(ListingCategory.vocabulary(), rawCategory);
    }

    private static String locationPrompt(String rawLocation) {
        return """
                Extract the state and city from this location: %s.

                Do not return abbreviations.
                Return your output as a JSON like this:
                {"state": "oklahoma", "city": "oklahoma city"}
                """.formatted(rawLocation);
    }

    private static String lower(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }
}
