package com.mouse.listings.logservice;

import com.mouse.listings.model.NotificationSummary;
import com.mouse.listings.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stage banners and the closing summary line of a pipeline cycle.
 */
@Slf4j
@Component
public class PipelineRunLogger {

    private static final String EMOJI_ROCKET = "🚀";
    private static final String EMOJI_SEARCH = "🔎";
    private static final String EMOJI_FILTER = "🧹";
    private static final String EMOJI_BROWSER = "🧭";
    private static final String EMOJI_SAVE = "💾";
    private static final String EMOJI_MAIL = "📧";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_SKIP = "⏭️";

    public void logRunStart(String runId) {
        log.info("{} Pipeline run started | RunId: {}", EMOJI_ROCKET, runId);
    }

    public void logDiscovered(String runId, int count) {
        log.info("{} Discovery done | RunId: {} | Candidates: {}", EMOJI_SEARCH, runId, count);
    }

    public void logFresh(String runId, int discovered, int fresh) {
        log.info("{} Freshness filter done | RunId: {} | Discovered: {} | Fresh: {}",
                EMOJI_FILTER, runId, discovered, fresh);
    }

    public void logAcquired(String runId, long accepted, long auctions, long failed) {
        log.info("{} Acquisition done | RunId: {} | Accepted: {} | Auctions: {} | Failed: {}",
                EMOJI_BROWSER, runId, accepted, auctions, failed);
    }

    public void logPersisted(String runId, long persisted) {
        log.info("{} Persistence done | RunId: {} | Upserted: {}", EMOJI_SAVE, runId, persisted);
    }

    public void logNotified(String runId, NotificationSummary summary) {
        log.info("{} Notification done | RunId: {} | Matched: {} | Emails: {} | Groups: {} | Failed groups: {}",
                EMOJI_MAIL, runId, summary.matchedSubscribers(), summary.emailsSent(),
                summary.groupsCreated(), summary.groupsFailed());
    }

    public void logSkipped(String reason) {
        log.warn("{} Pipeline run skipped | Reason: {}", EMOJI_SKIP, reason);
    }

    public void logRunFinished(RunSummary summary) {
        if (summary.isSuccess()) {
            log.info("{} Pipeline run finished | RunId: {} | Discovered: {} | Fresh: {} | Accepted: {} | Auctions: {} | Failed: {} | Persisted: {} | Duration: {}ms",
                    EMOJI_SUCCESS, summary.getRunId(), summary.getDiscovered(), summary.getFresh(),
                    summary.getAccepted(), summary.getAuctions(), summary.getFailed(), summary.getPersisted(),
                    summary.getDuration() != null ? summary.getDuration().toMillis() : -1);
        } else {
            log.error("{} Pipeline run failed | RunId: {} | Discovered: {} | Fresh: {} | Persisted: {} | Error: {}",
                    EMOJI_ERROR, summary.getRunId(), summary.getDiscovered(), summary.getFresh(),
                    summary.getPersisted(), summary.getError());
        }
    }
}
