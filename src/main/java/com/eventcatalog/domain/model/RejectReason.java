package com.eventcatalog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed vocabulary of hard-validation failures.
 * Declaration order is the order in which the validator checks them.
 */
public enum RejectReason {
    MISSING_TITLE("missing_title", "title"),
    TBD_IN_TITLE("tbd_in_title", "title"),
    TBD_IN_VENUE("tbd_in_venue", "venue_name"),
    MISSING_LOCATION("missing_location", "venue_name/address"),
    MISSING_START_DATE("missing_start_date", "event_start_date"),
    INVALID_DATE_FORMAT("invalid_date_format", "event_start_date"),
    MISSING_START_TIME("missing_start_time", "event_start_time"),
    MISSING_END_TIME("missing_end_time", "event_end_time"),
    TBD_IN_END_TIME("tbd_in_end_time", "event_end_time");

    private final String code;
    private final String field;

    RejectReason(String code, String field) {
        this.code = code;
        this.field = field;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Name of the normalized field that failed the check. */
    public String getField() {
        return field;
    }

    @Override
    public String toString() {
        return code;
    }
}
