package com.mouse.listings.interfaces;

import com.mouse.listings.exception.CampaignException;
import com.mouse.listings.model.CampaignRequest;
import com.mouse.listings.model.SubscriberProfile;

import java.util.Collection;
import java.util.List;

/**
 * Audience and campaign operations of the email platform. Every operation may
 * fail on its own with {@link CampaignException}.
 */
public interface CampaignPlatform {

    List<SubscriberProfile> fetchSubscribers();

    /** @return id of the created static segment */
    String createSegment(String name, Collection<String> emails);

    /** @return id of the created campaign */
    String createCampaign(CampaignRequest request);

    String getCampaignHtml(String campaignId);

    void setCampaignHtml(String campaignId, String html);

    void sendCampaign(String campaignId);

    void deleteSegment(String segmentId);
}
