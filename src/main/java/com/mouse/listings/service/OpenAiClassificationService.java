package com.mouse.listings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mouse.listings.config.ClassifierConfig;
import com.mouse.listings.exception.ClassificationException;
import com.mouse.listings.interfaces.ClassificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Chat-completions client for OpenAI-compatible endpoints, asking for a JSON object reply.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiClassificationService implements ClassificationService {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClassifierConfig classifierConfig;

    @Override
    public boolean isEnabled() {
        return classifierConfig.isEnabled();
    }

    @Override
    public JsonNode completeJson(String systemPrompt, String userPrompt) {
        Request request;
        try {
            request = new Request.Builder()
                    .url(classifierConfig.getBaseUrl() + "/v1/chat/completions")
                    .header("Authorization", "Bearer " + classifierConfig.getApiKey())
                    .post(RequestBody.create(buildPayload(systemPrompt, userPrompt), JSON))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ClassificationException("Invalid classifier request: " + e.getMessage(), e);
        }

        String content;
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new ClassificationException("Classifier returned HTTP " + response.code());
            }
            JsonNode root = objectMapper.readTree(body.string());
            content = root.path("choices").path(0).path("message").path("content").asText("");
        } catch (IOException e) {
            throw new ClassificationException("Classifier call failed", e);
        }

        try {
            JsonNode result = objectMapper.readTree(stripCodeFence(content));
            if (result == null || !result.isObject()) {
                throw new ClassificationException("Classifier reply is not a JSON object");
            }
            return result;
        } catch (IOException e) {
            log.warn("Unparseable classifier reply | Content: {}", content);
            throw new ClassificationException("Classifier reply is not valid JSON", e);
        }
    }

    private String buildPayload(String systemPrompt, String userPrompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", classifierConfig.getModel());
        payload.put("temperature", classifierConfig.getTemperature());
        payload.put("max_tokens", classifierConfig.getMaxTokens());
        payload.putObject("response_format").put("type", "json_object");

        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ClassificationException("Could not serialize classifier request", e);
        }
    }

    static String stripCodeFence(String content) {
        String text = content == null ? "" : content.trim();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.trim();
    }
}
