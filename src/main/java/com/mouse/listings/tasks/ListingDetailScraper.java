package com.mouse.listings.tasks;

import com.mouse.listings.config.ScraperConfig;
import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.exception.NavigationException;
import com.mouse.listings.exception.SessionCreationException;
import com.mouse.listings.interfaces.BrowserHandle;
import com.mouse.listings.manager.Session;
import com.mouse.listings.manager.SessionManager;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.ListingPageData;
import com.mouse.listings.model.ScrapeOutcome;
import com.mouse.listings.service.ListingEnrichmentService;
import com.mouse.listings.utils.ListingPageParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Runs the attempt sequence for one candidate on a worker's session:
 * navigate, check for a block page, wait for the listing to render, extract, accept.
 * A failed attempt resets the session before the next one; the session left after
 * the final failed attempt is handed back marked unhealthy and is not reset here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingDetailScraper {

    public static final String BLOCK_SIGNATURE = "access denied";

    private final SessionManager sessionManager;
    private final ListingPageParser pageParser;
    private final ListingEnrichmentService enrichmentService;
    private final ScraperConfig scraperConfig;

    /**
     * @param session the worker's current session, never null
     * @return outcome plus the session the worker should keep; session is null when a reset failed
     */
    public Result scrape(ListingCandidate candidate, Session session, Instant deadline) {
        int maxAttempts = Math.max(1, scraperConfig.getMaxAttempts());
        Session current = session;
        int resets = 0;
        int attempts = 0;
        String lastFailure = "not attempted";

        while (attempts < maxAttempts) {
            if (attempts > 0) {
                if (!Instant.now().isBefore(deadline)) {
                    lastFailure = "deadline exceeded after: " + lastFailure;
                    break;
                }
                try {
                    current = sessionManager.reset(current);
                    resets++;
                } catch (SessionCreationException e) {
                    log.warn("Session reset failed | Url: {} | Reason: {}", candidate.url(), e.getMessage());
                    return new Result(ScrapeOutcome.failed(candidate,
                            "session reset failed: " + e.getMessage(), attempts, resets), null, false);
                }
            }

            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                lastFailure = "deadline exceeded";
                break;
            }

            attempts++;
            AttemptResult attempt = attempt(candidate, current.getBrowserHandle(), deadline);

            if (attempt.record() != null) {
                log.info("Listing accepted | Url: {} | Attempt: {}/{} | Resets: {}",
                        candidate.url(), attempts, maxAttempts, resets);
                return new Result(ScrapeOutcome.accepted(candidate, attempt.record(), attempts, resets), current, true);
            }
            if (attempt.auctionPage() != null) {
                log.info("Auction listing, skipping | Url: {}", candidate.url());
                return new Result(ScrapeOutcome.auction(candidate, attempt.auctionPage(), attempts, resets), current, true);
            }

            lastFailure = attempt.failure();
            log.warn("Attempt failed | Url: {} | Attempt: {}/{} | Reason: {}",
                    candidate.url(), attempts, maxAttempts, lastFailure);
        }

        log.warn("Listing dropped | Url: {} | Attempts: {} | Resets: {} | Reason: {}",
                candidate.url(), attempts, resets, lastFailure);
        return new Result(ScrapeOutcome.failed(candidate, lastFailure, attempts, resets), current, attempts == 0);
    }

    private AttemptResult attempt(ListingCandidate candidate, BrowserHandle handle, Instant deadline) {
        try {
            handle.navigate(candidate.url(), capped(scraperConfig.getNavigationTimeoutMs(), deadline));

            if (isBlocked(handle.visibleText())) {
                return AttemptResult.failed("blocked: access denied page");
            }

            boolean loaded = handle.waitForSelector(ListingPageParser.LOAD_MARKER,
                    capped(scraperConfig.getLoadTimeoutMs(), deadline));
            String html = handle.content();
            ListingPageData data = pageParser.parse(html, candidate);

            if (!loaded) {
                return data.isAuction()
                        ? AttemptResult.auction(data)
                        : AttemptResult.failed("listing content did not load");
            }

            if (data.hasRequiredFields()) {
                ListingRecord record = enrichmentService.enrich(data);
                return AttemptResult.accepted(record);
            }

            return data.isAuction()
                    ? AttemptResult.auction(data)
                    : AttemptResult.failed("missing asking price or location");
        } catch (NavigationException e) {
            return AttemptResult.failed(e.getMessage());
        }
    }

    static boolean isBlocked(String pageText) {
        return pageText != null && pageText.toLowerCase(Locale.ROOT).contains(BLOCK_SIGNATURE);
    }

    private static Duration capped(long timeoutMs, Instant deadline) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        Duration configured = Duration.ofMillis(timeoutMs);
        if (remaining.isNegative()) {
            return Duration.ofMillis(1);
        }
        return remaining.compareTo(configured) < 0 ? remaining : configured;
    }

    public record Result(ScrapeOutcome outcome, Session session, boolean sessionHealthy) {
    }

    private record AttemptResult(ListingRecord record, ListingPageData auctionPage, String failure) {
        static AttemptResult accepted(ListingRecord record) {
            return new AttemptResult(record, null, null);
        }

        static AttemptResult auction(ListingPageData page) {
            return new AttemptResult(null, page, null);
        }

        static AttemptResult failed(String reason) {
            return new AttemptResult(null, null, reason);
        }
    }
}
