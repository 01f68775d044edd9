package com.mouse.listings.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import com.mouse.listings.exception.ClassificationException;

public interface ClassificationService {

    boolean isEnabled();

    /**
     * Sends one chat completion and returns the JSON object the model answered with.
     *
     * @throws ClassificationException on transport errors or a reply that is not a JSON object
     */
    JsonNode completeJson(String systemPrompt, String userPrompt);
}
