package com.mouse.listings.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.listings.config.ScraperConfig;
import com.mouse.listings.exception.ProxyUnavailableException;
import com.mouse.listings.model.ProxyIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fetches the proxy directory and hands out one identity at random.
 * The directory is fetched fresh on every call; nothing is cached between sessions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProxyProvider {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ScraperConfig scraperConfig;

    public boolean isEnabled() {
        return scraperConfig.isProxyEnabled();
    }

    /**
     * @throws ProxyUnavailableException when every attempt failed or the directory is empty
     */
    public ProxyIdentity pickRandom() {
        List<ProxyIdentity> proxies = fetchProxies();
        ProxyIdentity proxy = proxies.get(ThreadLocalRandom.current().nextInt(proxies.size()));
        log.info("Selected proxy | Proxy: {} | Pool: {}", proxy, proxies.size());
        return proxy;
    }

    public List<ProxyIdentity> fetchProxies() {
        int maxAttempts = Math.max(1, scraperConfig.getProxyMaxAttempts());
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<ProxyIdentity> proxies = requestDirectory();
                if (!proxies.isEmpty()) {
                    return proxies;
                }
                lastError = "directory returned no proxies";
            } catch (IOException e) {
                lastError = e.getMessage();
            }

            log.warn("Proxy directory attempt failed | Attempt: {}/{} | Reason: {}", attempt, maxAttempts, lastError);
            if (attempt < maxAttempts) {
                backoffBeforeRetry(attempt);
            }
        }
        throw new ProxyUnavailableException("No proxy available after " + maxAttempts + " attempts: " + lastError);
    }

    private List<ProxyIdentity> requestDirectory() throws IOException {
        Request request = new Request.Builder()
                .url(scraperConfig.getProxyListUrl())
                .header("Authorization", "Token " + scraperConfig.getProxyToken())
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("empty body");
            }
            return parseProxies(objectMapper.readTree(body.string()));
        }
    }

    private List<ProxyIdentity> parseProxies(JsonNode root) {
        List<ProxyIdentity> proxies = new ArrayList<>();
        for (JsonNode node : root.path("results")) {
            String host = node.path("proxy_address").asText(null);
            int port = node.path("port").asInt(0);
            if (host == null || host.isBlank() || port <= 0) {
                continue;
            }
            proxies.add(new ProxyIdentity(host, port,
                    node.path("username").asText(null),
                    node.path("password").asText(null)));
        }
        return proxies;
    }

    private void backoffBeforeRetry(int attempt) {
        long delay = scraperConfig.getProxyBackoffMs() * (1L << (attempt - 1));
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProxyUnavailableException("Interrupted while waiting for proxy directory", e);
        }
    }
}
