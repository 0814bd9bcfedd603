package com.eventcatalog.domain.normalization;

import com.eventcatalog.domain.model.LocationContext;
import com.eventcatalog.domain.model.NormalizedEvent;
import com.eventcatalog.domain.model.RawEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts provider output into {@link NormalizedEvent}s.
 *
 * Both the provider field names and the canonical ones are accepted, so an event
 * that was already normalized comes out unchanged when it is fed back in.
 */
@Component
public class EventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EventNormalizer.class);

    /**
     * Normalizes a single raw event.
     *
     * @param raw     provider record, may be null
     * @param context city/state at discovery time, may be null
     */
    public NormalizedEvent normalizeEvent(RawEvent raw, LocationContext context) {
        RawEvent event = raw != null ? raw : RawEvent.empty();
        LocationContext ctx = context != null ? context : LocationContext.empty();

        String startDate = FieldNormalizers.normalizeDate(event.text("event_date", "event_start_date", "date"));
        String endDate = FieldNormalizers.normalizeDate(event.text("event_end_date"));

        return NormalizedEvent.builder()
            .title(FieldNormalizers.normalizeTitle(event.text("title", "name")))
            .venueName(FieldNormalizers.normalizeVenueName(event.text("venue_name", "venue")))
            .address(trimToEmpty(event.text("address", "location")))
            .city(firstNonBlank(event.text("city"), ctx.city()))
            .state(firstNonBlank(event.text("state"), ctx.state()))
            .eventStartDate(startDate)
            .eventStartTime(FieldNormalizers.normalizeTime(event.text("event_time", "event_start_time", "time")))
            .eventEndTime(FieldNormalizers.normalizeTime(event.text("event_end_time", "end_time")))
            .eventEndDate(endDate != null ? endDate : startDate)
            .category(FieldNormalizers.normalizeCategory(event.text("category", "subtype")))
            .expectedAttendance(FieldNormalizers.normalizeAttendance(event.text("expected_attendance", "impact")))
            .coordinates(FieldNormalizers.normalizeCoordinates(
                event.firstPresent("lat", "latitude", "coordinates.lat"),
                event.firstPresent("lng", "longitude", "coordinates.lng")))
            .sourceModel(event.text("source_model"))
            .build();
    }

    /**
     * Normalizes every event of a batch, preserving order. A null batch yields an empty list.
     */
    public List<NormalizedEvent> normalizeEvents(List<RawEvent> rawEvents, LocationContext context) {
        if (rawEvents == null) {
            return List.of();
        }
        List<NormalizedEvent> normalized = new ArrayList<>(rawEvents.size());
        for (RawEvent raw : rawEvents) {
            normalized.add(normalizeEvent(raw, context));
        }
        logger.debug("Normalized {} events", normalized.size());
        return normalized;
    }

    /**
     * Re-runs normalization on an event that was already normalized.
     */
    public NormalizedEvent renormalize(NormalizedEvent event) {
        return normalizeEvent(RawEvent.from(event), LocationContext.empty());
    }

    private static String trimToEmpty(String value) {
        return value != null ? value.trim() : "";
    }

    private static String firstNonBlank(String value, String fallback) {
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return fallback != null ? fallback.trim() : "";
    }
}
