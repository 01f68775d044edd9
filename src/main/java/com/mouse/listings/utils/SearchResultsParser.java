package com.mouse.listings.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads listing references from the {@code SearchResultsPage} JSON-LD of an index page.
 */
@Component
@RequiredArgsConstructor
public class SearchResultsParser {

    private final ObjectMapper objectMapper;

    public record SearchResultItem(String title, String url, String productId) {
    }

    public List<SearchResultItem> parse(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(html, pageUrl);
        List<SearchResultItem> items = new ArrayList<>();

        for (JsonNode page : JsonLdNodes.ofType(document, objectMapper, "SearchResultsPage")) {
            for (JsonNode entry : page.path("about")) {
                if (!JsonLdNodes.isType(entry, "ListItem")) {
                    continue;
                }
                JsonNode item = entry.get("item");
                if (!JsonLdNodes.isType(item, "Product")) {
                    continue;
                }
                String title = JsonLdNodes.text(item, "name");
                String url = JsonLdNodes.text(item, "url");
                if (title == null || url == null) {
                    continue;
                }
                items.add(new SearchResultItem(title, url, JsonLdNodes.text(item, "productId")));
            }
        }
        return items;
    }
}
