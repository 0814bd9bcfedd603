package com.eventcatalog.domain.model;

/**
 * Latitude/longitude pair, rounded to 6 decimal places by the normalizer.
 */
public record Coordinates(double lat, double lng) {
}
