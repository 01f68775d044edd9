package com.mouse.listings.service;

import com.mouse.listings.config.NotifierConfig;
import com.mouse.listings.detector.ListingMatcher;
import com.mouse.listings.detector.SubscriberGrouper;
import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.interfaces.CampaignPlatform;
import com.mouse.listings.model.CampaignRequest;
import com.mouse.listings.model.MatchGroup;
import com.mouse.listings.model.NotificationSummary;
import com.mouse.listings.model.SubscriberProfile;
import com.mouse.listings.utils.ListingEmailRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Sends one campaign per group of subscribers with identical matches. Groups are
 * dispatched independently; a failed group is counted and the rest continue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final DateTimeFormatter SEGMENT_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final DateTimeFormatter TITLE_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CampaignPlatform campaignPlatform;
    private final ListingMatcher listingMatcher;
    private final SubscriberGrouper subscriberGrouper;
    private final ListingEmailRenderer emailRenderer;
    private final NotifierConfig notifierConfig;

    public NotificationSummary notify(List<ListingRecord> listings) {
        if (listings == null || listings.isEmpty()) {
            log.info("No new listings, nothing to notify");
            return NotificationSummary.empty();
        }

        List<SubscriberProfile> subscribers = campaignPlatform.fetchSubscribers();
        Map<String, List<ListingRecord>> matches = listingMatcher.matchAll(subscribers, listings);
        if (matches.isEmpty()) {
            log.info("No subscriber matched | Listings: {}", listings.size());
            return NotificationSummary.empty();
        }

        List<MatchGroup> groups = subscriberGrouper.group(matches);
        log.info("Grouped subscribers | Matched: {} | Groups: {}", matches.size(), groups.size());

        int emailsSent = 0;
        int groupsSent = 0;
        int groupsFailed = 0;
        for (MatchGroup group : groups) {
            if (dispatch(group)) {
                emailsSent += group.subscriberEmails().size();
                groupsSent++;
            } else {
                groupsFailed++;
            }
        }

        NotificationSummary summary = new NotificationSummary(matches.size(), emailsSent, groupsSent, groupsFailed);
        log.info("Notification finished | Emails: {} | Groups sent: {} | Groups failed: {}",
                emailsSent, groupsSent, groupsFailed);
        return summary;
    }

    boolean dispatch(MatchGroup group) {
        String shortKey = group.groupKey().substring(0, 8);
        LocalDateTime now = LocalDateTime.now();
        String segmentId = null;
        try {
            segmentId = campaignPlatform.createSegment(
                    "alerts-group-" + shortKey + "-" + SEGMENT_TS.format(now), group.subscriberEmails());

            String campaignId = campaignPlatform.createCampaign(new CampaignRequest(
                    segmentId,
                    subjectFor(group.listings().size()),
                    "Business Alerts Group - " + TITLE_TS.format(now) + " (" + group.subscriberEmails().size() + " recipients)"));

            String html = emailRenderer.merge(campaignPlatform.getCampaignHtml(campaignId),
                    emailRenderer.render(group.listings()));
            campaignPlatform.setCampaignHtml(campaignId, html);
            campaignPlatform.sendCampaign(campaignId);

            log.info("✅ Campaign sent | Group: {} | Campaign: {} | Recipients: {} | Listings: {}",
                    shortKey, campaignId, group.subscriberEmails().size(), group.listings().size());
            return true;
        } catch (RuntimeException e) {
            log.error("❌ Campaign failed | Group: {} | Segment: {} | Reason: {}", shortKey, segmentId, e.getMessage());
            return false;
        } finally {
            if (segmentId != null && notifierConfig.isCleanupSegments()) {
                cleanupSegment(segmentId);
            }
        }
    }

    private void cleanupSegment(String segmentId) {
        try {
            campaignPlatform.deleteSegment(segmentId);
            log.debug("Segment removed | Segment: {}", segmentId);
        } catch (RuntimeException e) {
            log.warn("Could not remove segment | Segment: {} | Reason: {}", segmentId, e.getMessage());
        }
    }

    String subjectFor(int listingCount) {
        return notifierConfig.getSubject() + " - " + listingCount + " New Listing" + (listingCount == 1 ? "" : "s");
    }
}
