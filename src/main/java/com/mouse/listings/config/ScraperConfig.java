package com.mouse.listings.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Component
@Data
@Configuration
public class ScraperConfig {
    private final List<String> BROWSER_FLAGS = Arrays.asList(
            // === Core Stealth Flags ===
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--disable-extensions",
            "--disable-default-apps",
            "--disable-popup-blocking",
            "--disable-notifications",
            "--mute-audio",
            "--no-first-run",
            "--lang=en-US",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    // ==================== BROWSER ====================

    @Value("${scraper.browser.headless:true}")
    private boolean headless;

    @Value("${scraper.browser.launch.timeout.ms:30000}")
    private int browserLaunchTimeoutMs;

    @Value("${scraper.browser.block-heavy-resources:true}")
    private boolean blockHeavyResources;

    // ==================== WORKER POOL ====================

    @Value("${scraper.workers:1}")
    private int workerCount;

    @Value("${scraper.max.attempts:2}")
    private int maxAttempts;

    @Value("${scraper.navigation.timeout.ms:30000}")
    private int navigationTimeoutMs;

    @Value("${scraper.load.timeout.ms:10000}")
    private int loadTimeoutMs;

    /** 0 derives the deadline from maxAttempts and the per-attempt timeouts */
    @Value("${scraper.candidate.deadline.ms:0}")
    private long candidateDeadlineMs;

    @Value("${scraper.pool.timeout.ms:3600000}")
    private long poolTimeoutMs;

    @Value("${scraper.queue.capacity:50}")
    private int queueCapacity;

    // ==================== PROXY DIRECTORY ====================

    @Value("${scraper.proxy.enabled:true}")
    private boolean proxyEnabled;

    @Value("${scraper.proxy.list-url:https://proxy.webshare.io/api/v2/proxy/list/?mode=direct&page=1&valid=true&page_size=25}")
    private String proxyListUrl;

    @Value("${scraper.proxy.token:}")
    private String proxyToken;

    @Value("${scraper.proxy.max.attempts:3}")
    private int proxyMaxAttempts;

    @Value("${scraper.proxy.backoff.ms:1000}")
    private long proxyBackoffMs;

    // ==================== DISCOVERY ====================

    @Value("${scraper.discovery.base-url:https://www.bizbuysell.com/businesses-for-sale/}")
    private String discoveryBaseUrl;

    @Value("${scraper.discovery.pages:1}")
    private int discoveryPages;

    @Value("${scraper.discovery.max.attempts:3}")
    private int discoveryMaxAttempts;

    @Value("${scraper.discovery.backoff.ms:2000}")
    private long discoveryBackoffMs;

    @Value("${scraper.request.timeout.ms:30000}")
    private int requestTimeoutMs;

    public Duration perAttemptTimeout() {
        return Duration.ofMillis((long) navigationTimeoutMs + loadTimeoutMs);
    }

    public Duration candidateDeadline() {
        if (candidateDeadlineMs > 0) {
            return Duration.ofMillis(candidateDeadlineMs);
        }
        return perAttemptTimeout().multipliedBy(Math.max(1, maxAttempts));
    }
}
