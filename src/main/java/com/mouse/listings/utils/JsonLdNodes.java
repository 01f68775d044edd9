package com.mouse.listings.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the embedded {@code application/ld+json} blocks of a page.
 */
@Slf4j
public final class JsonLdNodes {

    private JsonLdNodes() {
    }

    /**
     * Top-level JSON-LD objects whose {@code @type} equals {@code type}, in document order.
     * Blocks holding an array or an {@code @graph} are flattened one level. Malformed blocks are skipped.
     */
    public static List<JsonNode> ofType(Document document, ObjectMapper objectMapper, String type) {
        List<JsonNode> out = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(payload.trim());
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
                continue;
            }
            for (JsonNode node : flatten(root)) {
                if (isType(node, type)) {
                    out.add(node);
                }
            }
        }
        return out;
    }

    public static boolean isType(JsonNode node, String type) {
        if (node == null || !node.isObject()) {
            return false;
        }
        JsonNode typeNode = node.get("@type");
        if (typeNode == null) {
            return false;
        }
        if (typeNode.isTextual()) {
            return type.equals(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (type.equals(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Text value of {@code field}, or null when absent, null or blank.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static List<JsonNode> flatten(JsonNode root) {
        List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(nodes::add);
        } else if (root.isObject()) {
            nodes.add(root);
            JsonNode graph = root.get("@graph");
            if (graph != null && graph.isArray()) {
                graph.forEach(nodes::add);
            }
        }
        return nodes;
    }
}
