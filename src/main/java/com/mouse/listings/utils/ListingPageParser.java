package com.mouse.listings.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.ListingPageData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Extracts listing fields from a rendered detail page: the JSON-LD {@code Product}
 * block first, then the few fields only present in markup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingPageParser {

    public static final String LOAD_MARKER = "span.f-l";
    public static final String AUCTION_MARKER = "starting bid";

    private static final String BROKER_PREFIX = "Business Listed By:";
    private static final String FINANCIALS = "p.help span.g4";
    private static final int CASHFLOW_INDEX = 1;
    private static final int GROSS_REVENUE_INDEX = 2;

    private final ObjectMapper objectMapper;

    public ListingPageData parse(String html, ListingCandidate candidate) {
        Document document = Jsoup.parse(html == null ? "" : html, candidate.url());

        ListingPageData data = ListingPageData.builder()
                .url(candidate.url())
                .externalId(candidate.externalId())
                .title(candidate.title())
                .build();

        List<JsonNode> products = JsonLdNodes.ofType(document, objectMapper, "Product");
        if (!products.isEmpty()) {
            applyProduct(products.get(0), document, data);
        }

        data.setLocation(firstText(document, LOAD_MARKER));
        data.setBrokerPhone(firstText(document, "span.ctc_phone a span"));

        Elements financials = document.select(FINANCIALS);
        data.setCashflow(textAt(financials, CASHFLOW_INDEX));
        data.setGrossRevenue(textAt(financials, GROSS_REVENUE_INDEX));

        if (data.getEstablished() == null) {
            data.setEstablished(establishedRow(document));
        }
        data.setAuction(isAuction(document.text()));
        return data;
    }

    public static boolean isAuction(String pageText) {
        return pageText != null && pageText.toLowerCase(Locale.ROOT).contains(AUCTION_MARKER);
    }

    private void applyProduct(JsonNode product, Document document, ListingPageData data) {
        String name = JsonLdNodes.text(product, "name");
        if (name != null) {
            data.setTitle(name);
        }
        data.setDescription(JsonLdNodes.text(product, "description"));
        data.setRawCategory(JsonLdNodes.text(product, "category"));
        data.setEstablished(JsonLdNodes.text(product, "foundingDate"));

        String productId = JsonLdNodes.text(product, "productId");
        if (productId != null) {
            data.setExternalId(productId);
        }

        JsonNode offers = product.path("offers");
        if (offers.isArray()) {
            offers = offers.path(0);
        }
        data.setAskingPrice(JsonLdNodes.text(offers, "price"));

        JsonNode broker = offers.get("offeredBy");
        if (broker != null && broker.isObject()) {
            String brokerName = JsonLdNodes.text(broker, "name");
            if (brokerName == null) {
                brokerName = firstText(document, ".broker-card > div");
            }
            if (brokerName != null) {
                brokerName = brokerName.replace(BROKER_PREFIX, "").trim();
            }
            data.setBrokerName(brokerName);
            data.setBrokerProfileUrl(JsonLdNodes.text(broker, "url"));
        }
    }

    private String establishedRow(Document document) {
        Element label = document.selectFirst("*:containsOwn(Established:)");
        if (label == null) {
            return null;
        }
        String inline = label.ownText().replace("Established:", "").trim();
        if (!inline.isEmpty()) {
            return inline;
        }
        Element value = label.nextElementSibling();
        return value != null && !value.text().isBlank() ? value.text().trim() : null;
    }

    private static String firstText(Document document, String selector) {
        Element element = document.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private static String textAt(Elements elements, int index) {
        if (elements.size() <= index) {
            return null;
        }
        String text = elements.get(index).text().trim();
        return text.isEmpty() ? null : text;
    }
}
