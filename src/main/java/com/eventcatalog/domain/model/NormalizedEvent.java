package com.eventcatalog.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical event produced by the normalizer and consumed by validation and hashing.
 * Absent optional values are null and are omitted from JSON output.
 *
 * @param title              cleaned title, empty when unrepresentable
 * @param venueName          venue with any address portion stripped
 * @param address            address line, may be empty
 * @param city               city from the record or the ambient context
 * @param state              state from the record or the ambient context
 * @param eventStartDate     YYYY-MM-DD, or null
 * @param eventStartTime     24-hour HH:MM, or null
 * @param eventEndTime       24-hour HH:MM, or null
 * @param eventEndDate       YYYY-MM-DD, defaults to the start date
 * @param category           canonical category, never null
 * @param expectedAttendance high/medium/low, or null when the provider gave no opinion
 * @param coordinates        lat/lng, or null
 * @param sourceModel        provider provenance, carried through unchanged
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedEvent(
    @JsonProperty("title") String title,
    @JsonProperty("venue_name") String venueName,
    @JsonProperty("address") String address,
    @JsonProperty("city") String city,
    @JsonProperty("state") String state,
    @JsonProperty("event_start_date") String eventStartDate,
    @JsonProperty("event_start_time") String eventStartTime,
    @JsonProperty("event_end_time") String eventEndTime,
    @JsonProperty("event_end_date") String eventEndDate,
    @JsonProperty("category") EventCategory category,
    @JsonProperty("expected_attendance") AttendanceLevel expectedAttendance,
    @JsonProperty("coordinates") Coordinates coordinates,
    @JsonProperty("source_model") String sourceModel
) {

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .title(title)
            .venueName(venueName)
            .address(address)
            .city(city)
            .state(state)
            .eventStartDate(eventStartDate)
            .eventStartTime(eventStartTime)
            .eventEndTime(eventEndTime)
            .eventEndDate(eventEndDate)
            .category(category)
            .expectedAttendance(expectedAttendance)
            .coordinates(coordinates)
            .sourceModel(sourceModel);
    }

    public static final class Builder {
        private String title = "";
        private String venueName = "";
        private String address = "";
        private String city = "";
        private String state = "";
        private String eventStartDate;
        private String eventStartTime;
        private String eventEndTime;
        private String eventEndDate;
        private EventCategory category = EventCategory.OTHER;
        private AttendanceLevel expectedAttendance;
        private Coordinates coordinates;
        private String sourceModel;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder venueName(String venueName) {
            this.venueName = venueName;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder eventStartDate(String eventStartDate) {
            this.eventStartDate = eventStartDate;
            return this;
        }

        public Builder eventStartTime(String eventStartTime) {
            this.eventStartTime = eventStartTime;
            return this;
        }

        public Builder eventEndTime(String eventEndTime) {
            this.eventEndTime = eventEndTime;
            return this;
        }

        public Builder eventEndDate(String eventEndDate) {
            this.eventEndDate = eventEndDate;
            return this;
        }

        public Builder category(EventCategory category) {
            this.category = category;
            return this;
        }

        public Builder expectedAttendance(AttendanceLevel expectedAttendance) {
            this.expectedAttendance = expectedAttendance;
            return this;
        }

        public Builder coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder sourceModel(String sourceModel) {
            this.sourceModel = sourceModel;
            return this;
        }

        public NormalizedEvent build() {
            return new NormalizedEvent(title, venueName, address, city, state,
                eventStartDate, eventStartTime, eventEndTime, eventEndDate,
                category, expectedAttendance, coordinates, sourceModel);
        }
    }
}
