package com.mouse.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Alert preferences of one audience member. Set values are lower-cased;
 * an empty set means no constraint on that dimension.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberProfile {
    private String email;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;
    @Builder.Default
    private Set<String> industries = Set.of();
    @Builder.Default
    private Set<String> states = Set.of();
    @Builder.Default
    private Set<String> cities = Set.of();
}
