package com.mouse.listings.model;

import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.enums.OutcomeStatus;

import java.util.List;

public record AcquisitionReport(List<ScrapeOutcome> outcomes) {

    public static AcquisitionReport empty() {
        return new AcquisitionReport(List.of());
    }

    public List<ListingRecord> records() {
        return outcomes.stream()
                .filter(ScrapeOutcome::isAccepted)
                .map(ScrapeOutcome::record)
                .toList();
    }

    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
