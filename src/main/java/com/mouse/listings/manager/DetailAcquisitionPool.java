package com.mouse.listings.manager;

import com.mouse.listings.config.ScraperConfig;
import com.mouse.listings.enums.OutcomeStatus;
import com.mouse.listings.model.AcquisitionReport;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.ScrapeOutcome;
import com.mouse.listings.tasks.AcquisitionWorker;
import com.mouse.listings.tasks.ListingDetailScraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans candidates out to a fixed number of workers through a bounded queue and
 * collects their outcomes in completion order. The whole run is bounded by the
 * pool timeout; workers still busy after it are interrupted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetailAcquisitionPool {

    private final SessionManager sessionManager;
    private final ListingDetailScraper scraper;
    private final ScraperConfig scraperConfig;

    public AcquisitionReport acquireAll(List<ListingCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return AcquisitionReport.empty();
        }

        int workers = Math.max(1, Math.min(scraperConfig.getWorkerCount(), candidates.size()));
        BlockingQueue<ListingCandidate> queue = new ArrayBlockingQueue<>(Math.max(1, scraperConfig.getQueueCapacity()));
        Queue<ScrapeOutcome> results = new ConcurrentLinkedQueue<>();
        Instant poolDeadline = Instant.now().plusMillis(scraperConfig.getPoolTimeoutMs());

        log.info("Acquisition started | Candidates: {} | Workers: {} | MaxAttempts: {}",
                candidates.size(), workers, scraperConfig.getMaxAttempts());

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        for (int i = 1; i <= workers; i++) {
            executor.execute(AcquisitionWorker.builder()
                    .workerId(i)
                    .queue(queue)
                    .results(results)
                    .sessionManager(sessionManager)
                    .scraper(scraper)
                    .candidateDeadline(scraperConfig.candidateDeadline())
                    .poolDeadline(poolDeadline)
                    .build());
        }
        executor.shutdown();

        feed(queue, candidates, workers, poolDeadline);
        awaitWorkers(executor, poolDeadline);

        AcquisitionReport report = new AcquisitionReport(withMissingAsFailed(candidates, new ArrayList<>(results)));
        log.info("Acquisition finished | Accepted: {} | Auctions: {} | Failed: {}",
                report.count(OutcomeStatus.ACCEPTED), report.count(OutcomeStatus.AUCTION), report.count(OutcomeStatus.FAILED));
        return report;
    }

    private void feed(BlockingQueue<ListingCandidate> queue, List<ListingCandidate> candidates,
                      int workers, Instant poolDeadline) {
        try {
            for (ListingCandidate candidate : candidates) {
                if (!queue.offer(candidate, remainingMs(poolDeadline), TimeUnit.MILLISECONDS)) {
                    log.warn("Queue still full at pool timeout, stopping feed | Url: {}", candidate.url());
                    return;
                }
            }
            for (int i = 0; i < workers; i++) {
                if (!queue.offer(AcquisitionWorker.STOP, remainingMs(poolDeadline), TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while feeding workers");
        }
    }

    private void awaitWorkers(ExecutorService executor, Instant poolDeadline) {
        try {
            if (!executor.awaitTermination(remainingMs(poolDeadline), TimeUnit.MILLISECONDS)) {
                log.warn("Pool timeout reached, interrupting workers");
                executor.shutdownNow();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<ScrapeOutcome> withMissingAsFailed(List<ListingCandidate> candidates, List<ScrapeOutcome> outcomes) {
        Set<ListingCandidate> finished = Collections.newSetFromMap(new IdentityHashMap<>());
        outcomes.forEach(o -> finished.add(o.candidate()));
        for (ListingCandidate candidate : candidates) {
            if (!finished.contains(candidate)) {
                outcomes.add(ScrapeOutcome.failed(candidate, "pool timeout", 0, 0));
            }
        }
        return outcomes;
    }

    private static long remainingMs(Instant deadline) {
        return Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "listing-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
