package com.mouse.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Stage counts of one pipeline cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {
    private String runId;
    private Instant startedAt;
    private int discovered;
    private int fresh;
    private long accepted;
    private long auctions;
    private long failed;
    private long persisted;
    private long persistRejected;
    private NotificationSummary notification;
    private Duration duration;
    private boolean success;
    private String error;
}
