package com.mouse.listings.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Controlled vocabulary for listing categories. Classifier output is only
 * accepted when it resolves to one of these labels.
 */
@Getter
public enum ListingCategory {
    AGRICULTURE("Agriculture"),
    AUTOMOTIVE("Automotive"),
    BOAT("Boat"),
    BEAUTY("Beauty"),
    PERSONAL_CARE("Personal Care"),
    BUILDING("Building"),
    CONSTRUCTION("Construction"),
    COMMUNICATION("Communication"),
    MEDIA("Media"),
    EDUCATION("Education"),
    CHILDREN("Children"),
    ENTERTAINMENT("Entertainment"),
    RECREATION("Recreation"),
    FINANCIAL_SERVICES("Financial Services"),
    HEALTH_CARE("Health Care"),
    FITNESS("Fitness"),
    MANUFACTURING("Manufacturing"),
    NON_CLASSIFIABLE("Non-classifiable Establishments"),
    ONLINE("Online"),
    TECHNOLOGY("Technology"),
    PET_SERVICES("Pet Services"),
    RESTAURANTS("Restaurants"),
    FOOD("Food"),
    RETAIL("Retail"),
    SERVICE_BUSINESSES("Service Businesses"),
    REAL_ESTATE("Real Estate");

    private final String label;

    ListingCategory(String label) {
        this.label = label;
    }

    public static Optional<ListingCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public static String vocabulary() {
        return String.join(", ", Arrays.stream(values()).map(ListingCategory::getLabel).toList());
    }
}
