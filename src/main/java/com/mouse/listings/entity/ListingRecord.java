package com.mouse.listings.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A fully extracted and enriched listing. The document id is the listing key:
 * the site's listing id when known, otherwise the listing url.
 */
@Document(collection = "bizbuysell-data")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingRecord {

    @Id
    private String id;

    @Indexed(sparse = true)
    private String externalId;

    @Indexed
    private String url;

    private String title;
    private String askingPrice;
    private String grossRevenue;
    private String established;
    private String cashflow;
    private String description;

    @Builder.Default
    private List<String> category = new ArrayList<>();

    private String originalCategory;
    private String location;
    private String city;
    private String state;
    private String brokerName;
    private String brokerProfileUrl;
    private String brokerPhone;

    @Indexed
    private Instant scrapedAt;

    public static String keyOf(String externalId, String url) {
        return externalId != null && !externalId.isBlank() ? externalId : url;
    }

    @JsonIgnore
    public String key() {
        return keyOf(externalId, url);
    }
}
