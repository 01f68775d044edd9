package com.mouse.listings.tasks;

import com.mouse.listings.exception.SessionCreationException;
import com.mouse.listings.manager.Session;
import com.mouse.listings.manager.SessionManager;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.ScrapeOutcome;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;

/**
 * One worker of the acquisition pool. Takes candidates off the shared queue until it
 * sees the stop marker, and owns at most one browser session at any time. The session is
 * created on the first candidate and replaced only after it failed.
 */
@Slf4j
@Builder
public class AcquisitionWorker implements Runnable {

    /** Queue marker telling a worker to stop. Compared by identity. */
    public static final ListingCandidate STOP = new ListingCandidate(null, null, null, null);

    private final int workerId;
    private final BlockingQueue<ListingCandidate> queue;
    private final Queue<ScrapeOutcome> results;
    private final SessionManager sessionManager;
    private final ListingDetailScraper scraper;
    private final Duration candidateDeadline;
    private final Instant poolDeadline;

    @Override
    public void run() {
        Session session = null;
        boolean healthy = true;
        int processed = 0;
        log.info("Worker started | Worker: {} | Thread: {}", workerId, Thread.currentThread().getName());

        try {
            while (!Thread.currentThread().isInterrupted()) {
                ListingCandidate candidate = queue.take();
                if (candidate == STOP) {
                    break;
                }
                processed++;

                if (!Instant.now().isBefore(poolDeadline)) {
                    results.add(ScrapeOutcome.failed(candidate, "pool timeout", 0, 0));
                    continue;
                }

                if (session == null || !healthy) {
                    try {
                        session = session == null ? sessionManager.acquire() : sessionManager.reset(session);
                        healthy = true;
                    } catch (SessionCreationException e) {
                        log.error("Session unavailable | Worker: {} | Url: {} | Reason: {}",
                                workerId, candidate.url(), e.getMessage());
                        session = null;
                        results.add(ScrapeOutcome.failed(candidate, "session unavailable: " + e.getMessage(), 0, 0));
                        continue;
                    }
                }

                Instant deadline = earliest(Instant.now().plus(candidateDeadline), poolDeadline);
                try {
                    ListingDetailScraper.Result result = scraper.scrape(candidate, session, deadline);
                    session = result.session();
                    healthy = result.sessionHealthy();
                    results.add(result.outcome());
                } catch (RuntimeException e) {
                    log.error("Unexpected scrape error | Worker: {} | Url: {}", workerId, candidate.url(), e);
                    results.add(ScrapeOutcome.failed(candidate, "unexpected error: " + e.getMessage(), 0, 0));
                    healthy = false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted | Worker: {} | Processed: {}", workerId, processed);
        } finally {
            sessionManager.release(session);
            log.info("Worker stopped | Worker: {} | Processed: {}", workerId, processed);
        }
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
