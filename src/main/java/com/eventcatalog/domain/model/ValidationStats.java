package com.eventcatalog.domain.model;

import java.util.Map;

/**
 * Aggregate counts for one validated batch.
 *
 * @param total    events submitted
 * @param valid    events that passed every rule
 * @param invalid  events removed
 * @param byReason removals per reject reason, only reasons that occurred
 */
public record ValidationStats(int total, int valid, int invalid, Map<RejectReason, Integer> byReason) {

    public static ValidationStats empty() {
        return new ValidationStats(0, 0, 0, Map.of());
    }
}
