package com.mouse.listings.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.ListingPageData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ListingPageParserTest {

    private static final String URL = "https://www.bizbuysell.com/business-opportunity/established-taqueria/2291533/";

    private ListingPageParser parser;
    private ListingCandidate candidate;

    @BeforeEach
    void setUp() {
        parser = new ListingPageParser(new ObjectMapper());
        candidate = new ListingCandidate("Taqueria (index title)", URL, null, Instant.now());
    }

    @Nested
    @DisplayName("standard listing page")
    class StandardListing {

        @Test
        void parse_productJsonLd_fillsStructuredFields() {
            ListingPageData data = parser.parse(Fixtures.read("listing-detail.html"), candidate);

            assertThat(data.getTitle()).isEqualTo("Established Taqueria With Loyal Following");
            assertThat(data.getDescription()).startsWith("Turnkey restaurant");
            assertThat(data.getRawCategory()).isEqualTo("Restaurant");
            assertThat(data.getExternalId()).isEqualTo("2291533");
            assertThat(data.getAskingPrice()).isEqualTo("500000");
            assertThat(data.getBrokerProfileUrl()).contains("/business-broker/jane-doe/");
            assertThat(data.getUrl()).isEqualTo(URL);
        }

        @Test
        void parse_blankBrokerName_fallsBackToBrokerCardWithoutPrefix() {
            ListingPageData data = parser.parse(Fixtures.read("listing-detail.html"), candidate);

            assertThat(data.getBrokerName()).isEqualTo("Jane Doe");
        }

        @Test
        void parse_markupFields_usesFirstLocationAndPositionalFinancials() {
            ListingPageData data = parser.parse(Fixtures.read("listing-detail.html"), candidate);

            assertThat(data.getLocation()).isEqualTo("Las Vegas, NV");
            assertThat(data.getBrokerPhone()).isEqualTo("(702) 555-0100");
            assertThat(data.getCashflow()).isEqualTo("$180,000");
            assertThat(data.getGrossRevenue()).isEqualTo("$720,000");
            assertThat(data.getEstablished()).isEqualTo("2012");
        }

        @Test
        void parse_completePage_hasRequiredFieldsAndIsNotAuction() {
            ListingPageData data = parser.parse(Fixtures.read("listing-detail.html"), candidate);

            assertThat(data.hasRequiredFields()).isTrue();
            assertThat(data.isAuction()).isFalse();
        }
    }

    @Nested
    @DisplayName("auction and degenerate pages")
    class OtherPages {

        @Test
        void parse_auctionPage_flagsAuctionWithoutRequiredFields() {
            ListingPageData data = parser.parse(Fixtures.read("listing-auction.html"), candidate);

            assertThat(data.isAuction()).isTrue();
            assertThat(data.hasRequiredFields()).isFalse();
            assertThat(data.getExternalId()).isEqualTo("2299001");
            assertThat(data.getAskingPrice()).isNull();
        }

        @Test
        void parse_pageWithoutJsonLd_keepsCandidateIdentity() {
            ListingPageData data = parser.parse("<html><body><span class=\"f-l\">Reno, NV</span></body></html>", candidate);

            assertThat(data.getTitle()).isEqualTo("Taqueria (index title)");
            assertThat(data.getUrl()).isEqualTo(URL);
            assertThat(data.getLocation()).isEqualTo("Reno, NV");
            assertThat(data.getAskingPrice()).isNull();
            assertThat(data.getCashflow()).isNull();
        }

        @Test
        void parse_nullHtml_returnsEmptyData() {
            ListingPageData data = parser.parse(null, candidate);

            assertThat(data.hasRequiredFields()).isFalse();
            assertThat(data.isAuction()).isFalse();
        }
    }

    @Test
    void isAuction_caseInsensitiveMarker() {
        assertThat(ListingPageParser.isAuction("STARTING BID: $10")).isTrue();
        assertThat(ListingPageParser.isAuction("Asking Price: $10")).isFalse();
        assertThat(ListingPageParser.isAuction(null)).isFalse();
    }
}
