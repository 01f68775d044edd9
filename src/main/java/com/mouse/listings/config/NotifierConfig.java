package com.mouse.listings.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
public class NotifierConfig {

    @Value("${notifier.mailchimp.api-key:}")
    private String apiKey;

    @Value("${notifier.mailchimp.list-id:}")
    private String listId;

    @Value("${notifier.mailchimp.template-id:0}")
    private long templateId;

    /** Overrides the data-center url derived from the api key suffix */
    @Value("${notifier.mailchimp.base-url:}")
    private String baseUrl;

    @Value("${notifier.mailchimp.member-count:1000}")
    private int memberCount;

    @Value("${notifier.subject:New BizBuySell Listings}")
    private String subject;

    @Value("${notifier.from-name:BizBuySell Alerts}")
    private String fromName;

    @Value("${notifier.reply-to:}")
    private String replyTo;

    @Value("${notifier.cleanup-segments:false}")
    private boolean cleanupSegments;

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }
        int dash = apiKey == null ? -1 : apiKey.lastIndexOf('-');
        if (dash < 0 || dash == apiKey.length() - 1) {
            throw new IllegalStateException("Mailchimp api key has no data-center suffix");
        }
        return "https://" + apiKey.substring(dash + 1) + ".api.mailchimp.com/3.0";
    }
}
