package com.mouse.listings.service;

import com.mouse.listings.config.PipelineConfig;
import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.enums.OutcomeStatus;
import com.mouse.listings.exception.PartialWriteException;
import com.mouse.listings.logservice.PipelineRunLogger;
import com.mouse.listings.manager.DetailAcquisitionPool;
import com.mouse.listings.model.AcquisitionReport;
import com.mouse.listings.model.ListingCandidate;
import com.mouse.listings.model.NotificationSummary;
import com.mouse.listings.model.RunSummary;
import com.mouse.listings.tasks.ListingUrlCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One full cycle: discover, drop known listings, acquire details, persist, notify.
 * Only one cycle runs at a time; a concurrent trigger is skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ListingPipeline {

    private final ListingUrlCollector urlCollector;
    private final FreshnessFilter freshnessFilter;
    private final DetailAcquisitionPool acquisitionPool;
    private final ListingStore listingStore;
    private final NotificationService notificationService;
    private final PipelineRunLogger runLogger;
    private final PipelineConfig pipelineConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RunSummary runOnce() {
        if (!running.compareAndSet(false, true)) {
            runLogger.logSkipped("a run is already in progress");
            return RunSummary.builder()
                    .startedAt(Instant.now())
                    .success(false)
                    .error("already running")
                    .build();
        }
        try {
            return execute();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private RunSummary execute() {
        Instant start = Instant.now();
        RunSummary summary = RunSummary.builder()
                .runId(UUID.randomUUID().toString().substring(0, 8))
                .startedAt(start)
                .notification(NotificationSummary.empty())
                .build();
        runLogger.logRunStart(summary.getRunId());

        try {
            List<ListingCandidate> candidates = urlCollector.collect();
            summary.setDiscovered(candidates.size());
            runLogger.logDiscovered(summary.getRunId(), candidates.size());
            if (candidates.isEmpty()) {
                return finish(summary, start, false, "no listings discovered");
            }

            List<ListingCandidate> fresh = freshnessFilter.filter(candidates);
            summary.setFresh(fresh.size());
            runLogger.logFresh(summary.getRunId(), candidates.size(), fresh.size());
            if (fresh.isEmpty()) {
                return finish(summary, start, true, null);
            }

            AcquisitionReport report = acquisitionPool.acquireAll(fresh);
            summary.setAccepted(report.count(OutcomeStatus.ACCEPTED));
            summary.setAuctions(report.count(OutcomeStatus.AUCTION));
            summary.setFailed(report.count(OutcomeStatus.FAILED));
            runLogger.logAcquired(summary.getRunId(), summary.getAccepted(), summary.getAuctions(), summary.getFailed());

            List<ListingRecord> records = report.records();
            try {
                summary.setPersisted(listingStore.upsertAll(records));
            } catch (PartialWriteException e) {
                summary.setPersisted(e.getPersisted());
                summary.setPersistRejected(e.getRejected());
                runLogger.logPersisted(summary.getRunId(), summary.getPersisted());
                return finish(summary, start, false, e.getMessage());
            }
            runLogger.logPersisted(summary.getRunId(), summary.getPersisted());

            if (!pipelineConfig.isNotifyEnabled()) {
                return finish(summary, start, true, null);
            }
            try {
                NotificationSummary notification = notificationService.notify(records);
                summary.setNotification(notification);
                runLogger.logNotified(summary.getRunId(), notification);
            } catch (RuntimeException e) {
                log.error("Notification step failed | RunId: {}", summary.getRunId(), e);
                return finish(summary, start, false, "notification failed: " + e.getMessage());
            }
            return finish(summary, start, true, null);
        } catch (RuntimeException e) {
            log.error("Pipeline run aborted | RunId: {}", summary.getRunId(), e);
            return finish(summary, start, false, e.getMessage());
        }
    }

    private RunSummary finish(RunSummary summary, Instant start, boolean success, String error) {
        summary.setDuration(Duration.between(start, Instant.now()));
        summary.setSuccess(success);
        summary.setError(error);
        runLogger.logRunFinished(summary);
        return summary;
    }
}
