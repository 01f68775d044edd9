package com.mouse.listings.model;

public record NotificationSummary(int matchedSubscribers, int emailsSent, int groupsCreated, int groupsFailed) {
    public static NotificationSummary empty() {
        return new NotificationSummary(0, 0, 0, 0);
    }
}
