package com.mouse.listings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mouse.listings.config.NotifierConfig;
import com.mouse.listings.exception.CampaignException;
import com.mouse.listings.interfaces.CampaignPlatform;
import com.mouse.listings.model.CampaignRequest;
import com.mouse.listings.model.SubscriberProfile;
import com.mouse.listings.utils.PriceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mailchimp Marketing API v3 adapter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailchimpCampaignPlatform implements CampaignPlatform {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final NotifierConfig notifierConfig;

    @Override
    public List<SubscriberProfile> fetchSubscribers() {
        String path = "/lists/" + notifierConfig.getListId() + "/members?count=" + notifierConfig.getMemberCount();
        JsonNode root = call("GET", path, null);

        List<SubscriberProfile> subscribers = new ArrayList<>();
        for (JsonNode member : root.path("members")) {
            subscribers.add(toProfile(member));
        }
        log.info("Fetched subscribers | List: {} | Count: {}", notifierConfig.getListId(), subscribers.size());
        return subscribers;
    }

    @Override
    public String createSegment(String name, Collection<String> emails) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("name", name);
        emails.forEach(payload.putArray("static_segment")::add);

        JsonNode created = call("POST", "/lists/" + notifierConfig.getListId() + "/segments", payload);
        return requireId(created, "segment");
    }

    @Override
    public String createCampaign(CampaignRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("type", "regular");

        ObjectNode recipients = payload.putObject("recipients");
        recipients.put("list_id", notifierConfig.getListId());
        recipients.putObject("segment_opts").put("saved_segment_id", Long.parseLong(request.segmentId()));

        ObjectNode settings = payload.putObject("settings");
        settings.put("subject_line", request.subject());
        settings.put("title", request.title());
        settings.put("from_name", notifierConfig.getFromName());
        settings.put("reply_to", notifierConfig.getReplyTo());
        if (notifierConfig.getTemplateId() > 0) {
            settings.put("template_id", notifierConfig.getTemplateId());
        }

        JsonNode created = call("POST", "/campaigns", payload);
        return requireId(created, "campaign");
    }

    @Override
    public String getCampaignHtml(String campaignId) {
        return call("GET", "/campaigns/" + campaignId + "/content", null).path("html").asText("");
    }

    @Override
    public void setCampaignHtml(String campaignId, String html) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("html", html);
        call("PUT", "/campaigns/" + campaignId + "/content", payload);
    }

    @Override
    public void sendCampaign(String campaignId) {
        call("POST", "/campaigns/" + campaignId + "/actions/send", null);
    }

    @Override
    public void deleteSegment(String segmentId) {
        call("DELETE", "/lists/" + notifierConfig.getListId() + "/segments/" + segmentId, null);
    }

    private JsonNode call(String method, String path, JsonNode payload) {
        RequestBody body = null;
        if (payload != null) {
            body = RequestBody.create(payload.toString(), JSON);
        } else if ("POST".equals(method) || "PUT".equals(method)) {
            body = RequestBody.create(new byte[0], null);
        }

        Request request = new Request.Builder()
                .url(notifierConfig.resolveBaseUrl() + path)
                .header("Authorization", Credentials.basic("anystring", notifierConfig.getApiKey()))
                .method(method, body)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new CampaignException(method + " " + stripQuery(path) + " failed with HTTP "
                        + response.code() + ": " + detail(text));
            }
            return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
        } catch (IOException e) {
            throw new CampaignException(method + " " + stripQuery(path) + " failed", e);
        }
    }

    private String requireId(JsonNode node, String what) {
        String id = node.path("id").asText("");
        if (id.isBlank()) {
            throw new CampaignException("Mailchimp returned no " + what + " id");
        }
        return id;
    }

    private String detail(String body) {
        try {
            JsonNode error = objectMapper.readTree(body);
            return error.path("title").asText("") + " " + error.path("detail").asText("");
        } catch (IOException e) {
            return body.length() > 200 ? body.substring(0, 200) : body;
        }
    }

    private static String stripQuery(String path) {
        int q = path.indexOf('?');
        return q < 0 ? path : path.substring(0, q);
    }

    static SubscriberProfile toProfile(JsonNode member) {
        JsonNode fields = member.path("merge_fields");
        return SubscriberProfile.builder()
                .email(member.path("email_address").asText(null))
                .minPrice(price(fields.get("DPR_MIN")))
                .maxPrice(price(fields.get("DPR_MAX")))
                .industries(splitList(fields.path("INDUSTRIES").asText("")))
                .states(splitList(fields.path("STATES").asText("")))
                .cities(splitList(fields.path("CITIES").asText("")))
                .build();
    }

    private static BigDecimal price(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return PriceParser.parse(node.asText()).orElse(null);
    }

    static Set<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(raw.replace("\u00a0", "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
