package com.eventcatalog.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Expected crowd size reported by a discovery provider.
 */
public enum AttendanceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String canonicalKey;

    AttendanceLevel(String canonicalKey) {
        this.canonicalKey = canonicalKey;
    }

    @JsonValue
    public String getCanonicalKey() {
        return canonicalKey;
    }

    /**
     * Returns the matching level, or null when the value is blank or not one of high/medium/low.
     */
    public static AttendanceLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (AttendanceLevel level : values()) {
            if (level.canonicalKey.equals(key)) {
                return level;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return canonicalKey;
    }
}
