package com.mouse.listings.model;

import com.mouse.listings.entity.ListingRecord;

import java.util.List;

public record StoreStats(long totalListings, List<ListingRecord> latest) {
}
