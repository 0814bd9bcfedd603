package com.eventcatalog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Canonical event categories of the catalog.
 * Constants are declared in matching precedence: the first category whose
 * keyword list hits the raw value wins. Broad keywords ("music", "live") are only
 * tried once no category matched specifically, so "Broadway Musical" stays theater.
 */
public enum EventCategory {
    CONCERT("concert", List.of("concert", "live music", "music festival", "symphony", "orchestra"), List.of("music", "live")),
    SPORTS("sports", List.of("sport", "nba", "nfl", "nhl", "mlb", "mls", "ncaa", "game", "match", "tournament", "marathon")),
    THEATER("theater", List.of("theater", "theatre", "broadway", "musical", "comedy", "standup", "stand-up", "opera", "ballet", "performance")),
    CONFERENCE("conference", List.of("conference", "convention", "expo", "summit", "trade show", "symposium")),
    FESTIVAL("festival", List.of("festival", "fair", "parade", "carnival")),
    NIGHTLIFE("nightlife", List.of("nightlife", "nightclub", "night club", "club", "bar crawl", "party", "dj")),
    CIVIC("civic", List.of("civic", "community", "charity", "fundraiser", "rally", "protest", "town hall", "city council", "government")),
    ACADEMIC("academic", List.of("academic", "university", "college", "graduation", "commencement", "school", "lecture", "campus")),
    AIRPORT("airport", List.of("airport", "flight", "terminal", "airline")),
    OTHER("other", List.of());

    private final String canonicalKey;
    private final List<String> keywords;
    private final List<String> broadKeywords;

    EventCategory(String canonicalKey, List<String> keywords) {
        this(canonicalKey, keywords, List.of());
    }

    EventCategory(String canonicalKey, List<String> keywords, List<String> broadKeywords) {
        this.canonicalKey = canonicalKey;
        this.keywords = keywords;
        this.broadKeywords = broadKeywords;
    }

    @JsonValue
    public String getCanonicalKey() {
        return canonicalKey;
    }

    /**
     * Maps a free-text category hint by case-insensitive keyword containment.
     * Blank or unmatched input maps to {@link #OTHER}.
     */
    public static EventCategory fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return OTHER;
        }
        String lower = hint.toLowerCase(Locale.ROOT);
        for (EventCategory category : values()) {
            if (containsAny(lower, category.keywords)) {
                return category;
            }
        }
        for (EventCategory category : values()) {
            if (containsAny(lower, category.broadKeywords)) {
                return category;
            }
        }
        return OTHER;
    }

    private static boolean containsAny(String value, List<String> keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return canonicalKey;
    }
}
