package com.eventcatalog.domain.model;

/**
 * City/state in effect when a batch of events was discovered.
 * Raw records that carry their own city or state override it.
 */
public record LocationContext(String city, String state) {

    private static final LocationContext EMPTY = new LocationContext("", "");

    public static LocationContext empty() {
        return EMPTY;
    }
}
