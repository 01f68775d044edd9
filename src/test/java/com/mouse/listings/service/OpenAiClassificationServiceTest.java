package com.mouse.listings.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.listings.config.ClassifierConfig;
import com.mouse.listings.exception.ClassificationException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiClassificationServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private OpenAiClassificationService service;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        ClassifierConfig config = new ClassifierConfig();
        config.setApiKey("sk-test");
        config.setBaseUrl(server.url("/").toString().replaceAll("/$", ""));
        config.setModel("gpt-4o-mini");
        config.setTemperature(0.3);
        config.setMaxTokens(200);

        service = new OpenAiClassificationService(new OkHttpClient(), mapper, config);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static String reply(String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"}}]}";
    }

    @Test
    void completeJson_postsChatRequestAndParsesContent() throws Exception {
        server.enqueue(new MockResponse().setBody(reply("{\"category\": [\"Retail\"]}")));

        JsonNode result = service.completeJson("system prompt", "user prompt");

        assertThat(result.path("category").get(0).asText()).isEqualTo("Retail");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");

        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.path("response_format").path("type").asText()).isEqualTo("json_object");
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("user prompt");
    }

    @Test
    void completeJson_fencedReply_isUnwrapped() {
        server.enqueue(new MockResponse().setBody(reply("```json\n{\"city\": \"tulsa\"}\n```")));

        assertThat(service.completeJson("s", "u").path("city").asText()).isEqualTo("tulsa");
    }

    @Test
    void completeJson_serverError_throws() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> service.completeJson("s", "u"))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("500");
    }

    @Test
    void completeJson_notJson_throws() {
        server.enqueue(new MockResponse().setBody(reply("I think it is a restaurant")));

        assertThatThrownBy(() -> service.completeJson("s", "u"))
                .isInstanceOf(ClassificationException.class);
    }

    @Test
    void stripCodeFence_plainTextUntouched() {
        assertThat(OpenAiClassificationService.stripCodeFence(" {\"a\":1} ")).isEqualTo("{\"a\":1}");
        assertThat(OpenAiClassificationService.stripCodeFence("```\n{}\n```")).isEqualTo("{}");
        assertThat(OpenAiClassificationService.stripCodeFence(null)).isEmpty();
    }

    @Test
    void isEnabled_followsApiKey() {
        ClassifierConfig config = new ClassifierConfig();
        config.setApiKey(" ");
        assertThat(new OpenAiClassificationService(new OkHttpClient(), mapper, config).isEnabled()).isFalse();
    }

    @Test
    void completeJson_malformedBaseUrl_raisesClassificationException() {
        ClassifierConfig config = new ClassifierConfig();
        config.setApiKey("sk-test");
        config.setBaseUrl("not a url");
        config.setModel("gpt-4o-mini");
        OpenAiClassificationService misconfigured = new OpenAiClassificationService(new OkHttpClient(), mapper, config);

        assertThatThrownBy(() -> misconfigured.completeJson("system", "user"))
                .isInstanceOf(ClassificationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
