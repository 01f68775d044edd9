package com.mouse.listings.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
public class ClassifierConfig {

    @Value("${classifier.api-key:}")
    private String apiKey;

    @Value("${classifier.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${classifier.model:gpt-4o-mini}")
    private String model;

    @Value("${classifier.temperature:0.3}")
    private double temperature;

    @Value("${classifier.max-tokens:200}")
    private int maxTokens;

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }
}
