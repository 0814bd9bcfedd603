package com.eventcatalog.domain.model;

/**
 * Outcome of hard validation for one event. {@code reason} is null when valid.
 */
public record ValidationVerdict(boolean valid, RejectReason reason) {

    private static final ValidationVerdict VALID = new ValidationVerdict(true, null);

    public static ValidationVerdict ok() {
        return VALID;
    }

    public static ValidationVerdict reject(RejectReason reason) {
        return new ValidationVerdict(false, reason);
    }

    /** Field that failed, or null for a valid verdict. */
    public String field() {
        return reason != null ? reason.getField() : null;
    }
}
