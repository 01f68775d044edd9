package com.mouse.listings.model;

public record LocationInfo(String city, String state) {
    public static LocationInfo empty() {
        return new LocationInfo(null, null);
    }
}
