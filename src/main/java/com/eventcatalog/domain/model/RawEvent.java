package com.eventcatalog.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untyped event record as returned by a discovery provider.
 * Any field may be missing, empty or of an unexpected type; accessors never throw.
 */
public final class RawEvent {

    private static final RawEvent EMPTY = new RawEvent(Map.of());

    private final Map<String, Object> fields;

    private RawEvent(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * Wraps a provider field map. Null maps and null keys are tolerated.
     */
    public static RawEvent of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value);
            }
        });
        return new RawEvent(Collections.unmodifiableMap(copy));
    }

    public static RawEvent empty() {
        return EMPTY;
    }

    /**
     * Feeds a normalized event back in under its canonical field names,
     * so it can be normalized again.
     */
    public static RawEvent from(NormalizedEvent event) {
        if (event == null) {
            return EMPTY;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("title", event.title());
        map.put("venue_name", event.venueName());
        map.put("address", event.address());
        map.put("city", event.city());
        map.put("state", event.state());
        map.put("event_start_date", event.eventStartDate());
        map.put("event_start_time", event.eventStartTime());
        map.put("event_end_time", event.eventEndTime());
        map.put("event_end_date", event.eventEndDate());
        map.put("category", event.category() != null ? event.category().getCanonicalKey() : null);
        map.put("expected_attendance",
            event.expectedAttendance() != null ? event.expectedAttendance().getCanonicalKey() : null);
        if (event.coordinates() != null) {
            map.put("lat", event.coordinates().lat());
            map.put("lng", event.coordinates().lng());
        }
        map.put("source_model", event.sourceModel());
        return of(map);
    }

    /**
     * Raw value of a field; nested maps can be reached with a dotted path ("coordinates.lat").
     */
    public Object value(String key) {
        if (key == null) {
            return null;
        }
        if (fields.containsKey(key)) {
            return fields.get(key);
        }
        int dot = key.indexOf('.');
        if (dot > 0 && fields.get(key.substring(0, dot)) instanceof Map<?, ?> nested) {
            return nested.get(key.substring(dot + 1));
        }
        return null;
    }

    /**
     * First non-blank textual value among the given field names.
     * Numbers and booleans are rendered as text; objects and arrays are ignored.
     */
    public String text(String... keys) {
        for (String key : keys) {
            String text = asText(value(key));
            if (text != null && !text.isBlank()) {
                return text;
            }
        }
        return null;
    }

    /**
     * First value among the given field names that is not null or a blank string.
     */
    public Object firstPresent(String... keys) {
        for (String key : keys) {
            Object value = value(key);
            if (value == null) {
                continue;
            }
            if (value instanceof CharSequence chars && chars.toString().isBlank()) {
                continue;
            }
            return value;
        }
        return null;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private static String asText(Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RawEvent other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "RawEvent" + fields;
    }
}
