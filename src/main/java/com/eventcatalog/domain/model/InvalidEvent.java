package com.eventcatalog.domain.model;

/**
 * An event removed by batch validation, together with why.
 */
public record InvalidEvent(NormalizedEvent event, RejectReason reason) {

    public String field() {
        return reason.getField();
    }
}
