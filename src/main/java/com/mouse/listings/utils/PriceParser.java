package com.mouse.listings.utils;

import java.math.BigDecimal;
import java.util.Optional;

public final class PriceParser {

    private PriceParser() {
    }

    /**
     * Parses values like {@code "$1,250,000"} or {@code "500000.0"}. Anything else is empty.
     */
    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = raw.replace("$", "").replace(",", "").replace("\u00a0", "").replace(" ", "").trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
