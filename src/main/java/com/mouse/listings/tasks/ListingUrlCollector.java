package com.mouse.listings.tasks;

import com.mouse.listings.config.ScraperConfig;
import com.mouse.listings.exception.ProxyUnavailableException;
import com.mouse.listings.interceptor.HeadersInterceptor;
import com.mouse.listings.manager.ProfileManager;
import com.mouse.listings.manager.ProxyProvider;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.ProxyIdentity;
import com.mouse.listings.utils.SearchResultsParser;
import com.mouse.listings.utils.SearchResultsParser.SearchResultItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the paginated index and turns its JSON-LD search results into candidates.
 * Each page fetch goes out on a fresh proxy with a random browser profile.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingUrlCollector {

    private final OkHttpClient httpClient;
    private final ProxyProvider proxyProvider;
    private final ProfileManager profileManager;
    private final SearchResultsParser searchResultsParser;
    private final ScraperConfig scraperConfig;

    public List<ListingCandidate> collect() {
        Set<String> seenUrls = new HashSet<>();
        List<ListingCandidate> candidates = new ArrayList<>();

        for (int page = 1; page <= scraperConfig.getDiscoveryPages(); page++) {
            String pageUrl = pageUrl(page);
            Optional<String> html = fetchPage(pageUrl);
            if (html.isEmpty()) {
                log.warn("Index page skipped | Page: {} | Url: {}", page, pageUrl);
                continue;
            }

            int before = candidates.size();
            for (SearchResultItem item : searchResultsParser.parse(html.get(), pageUrl)) {
                if (!isNewUrl(item.url(), seenUrls)) {
                    continue;
                }
                candidates.add(new ListingCandidate(item.title(), item.url(), item.productId(), Instant.now()));
            }
            log.info("Index page collected | Page: {} | New: {} | Total: {}", page, candidates.size() - before, candidates.size());
        }
        return candidates;
    }

    /**
     * Registers the url and reports whether it was unseen in this run.
     */
    static boolean isNewUrl(String url, Set<String> seenUrls) {
        return url != null && seenUrls.add(url);
    }

    String pageUrl(int page) {
        String base = scraperConfig.getDiscoveryBaseUrl();
        return (base.endsWith("/") ? base : base + "/") + page;
    }

    Optional<String> fetchPage(String pageUrl) {
        int maxAttempts = Math.max(1, scraperConfig.getDiscoveryMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return Optional.of(fetchOnce(pageUrl));
            } catch (IOException | ProxyUnavailableException e) {
                log.warn("Index fetch failed | Url: {} | Attempt: {}/{} | Reason: {}",
                        pageUrl, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && !backoffBeforeRetry(attempt)) {
                break;
            }
        }
        return Optional.empty();
    }

    private String fetchOnce(String pageUrl) throws IOException {
        OkHttpClient.Builder builder = httpClient.newBuilder()
                .addInterceptor(new HeadersInterceptor(profileManager.getRandomProfile(), "https://www.bizbuysell.com/"));

        if (proxyProvider.isEnabled()) {
            ProxyIdentity proxy = proxyProvider.pickRandom();
            builder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxy.host(), proxy.port())));
            if (proxy.hasCredentials()) {
                String credential = Credentials.basic(proxy.username(), proxy.password());
                builder.proxyAuthenticator((route, response) -> {
                    if (response.request().header("Proxy-Authorization") != null) {
                        return null;
                    }
                    return response.request().newBuilder()
                            .header("Proxy-Authorization", credential)
                            .build();
                });
            }
        }

        Request request = new Request.Builder().url(pageUrl).get().build();
        try (Response response = builder.build().newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("HTTP " + response.code());
            }
            return body.string();
        }
    }

    private boolean backoffBeforeRetry(int attempt) {
        long delay = scraperConfig.getDiscoveryBackoffMs() * (1L << (attempt - 1));
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
