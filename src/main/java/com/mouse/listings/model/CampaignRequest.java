package com.mouse.listings.model;

public record CampaignRequest(String segmentId, String subject, String title) {
}
