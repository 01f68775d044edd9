package com.mouse.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields read from a rendered listing page, before enrichment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingPageData {
    private String externalId;
    private String url;
    private String title;
    private String description;
    private String rawCategory;
    private String askingPrice;
    private String grossRevenue;
    private String cashflow;
    private String established;
    private String location;
    private String brokerName;
    private String brokerProfileUrl;
    private String brokerPhone;
    private boolean auction;

    public boolean hasRequiredFields() {
        return askingPrice != null && !askingPrice.isBlank()
                && location != null && !location.isBlank();
    }
}
