package com.eventcatalog.domain.normalization;

import com.eventcatalog.domain.model.AttendanceLevel;
import com.eventcatalog.domain.model.Coordinates;
import com.eventcatalog.domain.model.EventCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FieldNormalizers.
 */
class FieldNormalizersTest {

    @Test
    void testNormalizeTitle() {
        // Surrounding quotes, straight and curly
        assertEquals("Concert at Stadium", FieldNormalizers.normalizeTitle("\"Concert at Stadium\""));
        assertEquals("Live Show", FieldNormalizers.normalizeTitle("'Live Show'"));
        assertEquals("Jazz Night", FieldNormalizers.normalizeTitle("“Jazz Night”"));
        assertEquals("Jazz Night", FieldNormalizers.normalizeTitle("‘Jazz Night’"));

        // Whitespace
        assertEquals("Concert at Stadium", FieldNormalizers.normalizeTitle("Concert   at \t Stadium"));
        assertEquals("Trimmed", FieldNormalizers.normalizeTitle("  Trimmed  "));

        // No case change, no truncation
        assertEquals("NBA: Mavericks vs. Lakers", FieldNormalizers.normalizeTitle("NBA: Mavericks vs. Lakers"));
    }

    @Test
    void testNormalizeTitleKeepsUnpairedQuotes() {
        assertEquals("\"O\" by Cirque du Soleil", FieldNormalizers.normalizeTitle("\"O\" by Cirque du Soleil"));
        assertEquals("\"Mismatched'", FieldNormalizers.normalizeTitle("\"Mismatched'"));
        assertEquals("\"", FieldNormalizers.normalizeTitle("\""));
    }

    @Test
    void testNormalizeTitleWithNullOrEmpty() {
        assertEquals("", FieldNormalizers.normalizeTitle(null));
        assertEquals("", FieldNormalizers.normalizeTitle(""));
        assertEquals("", FieldNormalizers.normalizeTitle("   "));
        assertEquals("", FieldNormalizers.normalizeTitle("\"\""));
    }

    @Test
    void testNormalizeTitleStripsNestedQuoteLayers() {
        assertEquals("X", FieldNormalizers.normalizeTitle("\"'X'\""));
        assertEquals("Jazz Night", FieldNormalizers.normalizeTitle("“'Jazz Night'”"));
    }

    @Test
    void testNormalizeTitleIsIdempotent() {
        String[] inputs = {"\"\"Double quoted\"\"", "' spaced  title '", "“Nested 'inner'”", "Plain"};
        for (String input : inputs) {
            String once = FieldNormalizers.normalizeTitle(input);
            assertEquals(once, FieldNormalizers.normalizeTitle(once), input);
        }
    }

    @Test
    void testNormalizeVenueName() {
        assertEquals("Madison Square Garden", FieldNormalizers.normalizeVenueName("Madison Square Garden, 4 Penn Plaza"));
        assertEquals("The Venue", FieldNormalizers.normalizeVenueName("  The Venue "));
        assertEquals("AT&T Stadium", FieldNormalizers.normalizeVenueName("AT&T Stadium, 1 AT&T Way, Arlington, TX"));
        assertEquals("", FieldNormalizers.normalizeVenueName(null));
        assertEquals("", FieldNormalizers.normalizeVenueName(""));
    }

    @Test
    void testNormalizeDate() {
        // Already ISO
        assertEquals("2026-01-15", FieldNormalizers.normalizeDate("2026-01-15"));
        assertEquals("2025-12-31", FieldNormalizers.normalizeDate(" 2025-12-31 "));

        // M/D/YYYY
        assertEquals("2026-01-15", FieldNormalizers.normalizeDate("01/15/2026"));
        assertEquals("2025-12-31", FieldNormalizers.normalizeDate("12/31/2025"));
        assertEquals("2026-01-05", FieldNormalizers.normalizeDate("1/5/2026"));

        // Month D, YYYY
        assertEquals("2026-01-15", FieldNormalizers.normalizeDate("January 15, 2026"));
        assertEquals("2026-03-07", FieldNormalizers.normalizeDate("march 7, 2026"));
        assertEquals("2026-02-01", FieldNormalizers.normalizeDate("Feb 1, 2026"));
        assertEquals("2026-11-20", FieldNormalizers.normalizeDate("November 20 2026"));
    }

    @Test
    void testNormalizeDateReturnsNullForInvalid() {
        assertNull(FieldNormalizers.normalizeDate("invalid"));
        assertNull(FieldNormalizers.normalizeDate("13/45/2026"));
        assertNull(FieldNormalizers.normalizeDate("02/30/2026"));
        assertNull(FieldNormalizers.normalizeDate("15 January 2026"));
        assertNull(FieldNormalizers.normalizeDate("Tomorrow"));
        assertNull(FieldNormalizers.normalizeDate(null));
        assertNull(FieldNormalizers.normalizeDate(""));
    }

    @Test
    void testNormalizeTime() {
        // 24-hour pass-through
        assertEquals("19:00", FieldNormalizers.normalizeTime("19:00"));
        assertEquals("09:30", FieldNormalizers.normalizeTime("09:30"));

        // 12-hour
        assertEquals("19:00", FieldNormalizers.normalizeTime("7 PM"));
        assertEquals("19:30", FieldNormalizers.normalizeTime("7:30 PM"));
        assertEquals("12:00", FieldNormalizers.normalizeTime("12 PM"));
        assertEquals("00:00", FieldNormalizers.normalizeTime("12 AM"));
        assertEquals("11:00", FieldNormalizers.normalizeTime("11 AM"));
        assertEquals("00:15", FieldNormalizers.normalizeTime("12:15 am"));

        // Case and spacing
        assertEquals("19:00", FieldNormalizers.normalizeTime("7pm"));
        assertEquals("19:30", FieldNormalizers.normalizeTime("7:30PM"));
        assertEquals("19:00", FieldNormalizers.normalizeTime("7 pm"));
        assertEquals("19:00", FieldNormalizers.normalizeTime("7 p.m."));

        // Single-digit 24-hour
        assertEquals("07:30", FieldNormalizers.normalizeTime("7:30"));
    }

    @Test
    void testNormalizeTimeReturnsNullForInvalid() {
        assertNull(FieldNormalizers.normalizeTime("invalid"));
        assertNull(FieldNormalizers.normalizeTime("TBD"));
        assertNull(FieldNormalizers.normalizeTime("13 PM"));
        assertNull(FieldNormalizers.normalizeTime("25:00"));
        assertNull(FieldNormalizers.normalizeTime("7:75 PM"));
        assertNull(FieldNormalizers.normalizeTime(null));
        assertNull(FieldNormalizers.normalizeTime(""));
    }

    @Test
    void testNormalizeCategory() {
        assertEquals(EventCategory.CONCERT, FieldNormalizers.normalizeCategory("concert"));
        assertEquals(EventCategory.CONCERT, FieldNormalizers.normalizeCategory("Live Music"));
        assertEquals(EventCategory.CONCERT, FieldNormalizers.normalizeCategory("Music Festival"));
        assertEquals(EventCategory.SPORTS, FieldNormalizers.normalizeCategory("sports"));
        assertEquals(EventCategory.SPORTS, FieldNormalizers.normalizeCategory("NBA Game"));
        assertEquals(EventCategory.SPORTS, FieldNormalizers.normalizeCategory("NFL Football"));
        assertEquals(EventCategory.CONCERT, FieldNormalizers.normalizeCategory("Music"));
        assertEquals(EventCategory.CONCERT, FieldNormalizers.normalizeCategory("Live Band"));
        assertEquals(EventCategory.CONCERT, FieldNormalizers.normalizeCategory("live entertainment"));
        assertEquals(EventCategory.THEATER, FieldNormalizers.normalizeCategory("Broadway Musical"));
        assertEquals(EventCategory.THEATER, FieldNormalizers.normalizeCategory("Musical"));
        assertEquals(EventCategory.CONFERENCE, FieldNormalizers.normalizeCategory("Tech Convention"));
        assertEquals(EventCategory.FESTIVAL, FieldNormalizers.normalizeCategory("State Fair"));
        assertEquals(EventCategory.NIGHTLIFE, FieldNormalizers.normalizeCategory("Nightclub"));
        assertEquals(EventCategory.CIVIC, FieldNormalizers.normalizeCategory("Charity Gala"));
        assertEquals(EventCategory.ACADEMIC, FieldNormalizers.normalizeCategory("University Graduation"));
        assertEquals(EventCategory.AIRPORT, FieldNormalizers.normalizeCategory("Airport Arrivals Surge"));
    }

    @Test
    void testNormalizeCategoryDefaultsToOther() {
        assertEquals(EventCategory.OTHER, FieldNormalizers.normalizeCategory("random"));
        assertEquals(EventCategory.OTHER, FieldNormalizers.normalizeCategory(""));
        assertEquals(EventCategory.OTHER, FieldNormalizers.normalizeCategory(null));
    }

    @Test
    void testCanonicalCategoriesMapToThemselves() {
        for (EventCategory category : EventCategory.values()) {
            assertEquals(category, FieldNormalizers.normalizeCategory(category.getCanonicalKey()));
        }
    }

    @Test
    void testNormalizeAttendance() {
        assertEquals(AttendanceLevel.HIGH, FieldNormalizers.normalizeAttendance("high"));
        assertEquals(AttendanceLevel.MEDIUM, FieldNormalizers.normalizeAttendance("Medium"));
        assertEquals(AttendanceLevel.LOW, FieldNormalizers.normalizeAttendance(" LOW "));

        // No opinion stays absent
        assertNull(FieldNormalizers.normalizeAttendance("huge"));
        assertNull(FieldNormalizers.normalizeAttendance(""));
        assertNull(FieldNormalizers.normalizeAttendance(null));
    }

    @Test
    void testNormalizeCoordinates() {
        assertEquals(new Coordinates(40.750504, -73.993439),
            FieldNormalizers.normalizeCoordinates("40.750504", "-73.993439"));
        assertEquals(new Coordinates(32.7767, -96.797),
            FieldNormalizers.normalizeCoordinates(32.7767, -96.797));
        assertEquals(new Coordinates(32.123457, -96.0),
            FieldNormalizers.normalizeCoordinates(32.1234567, -96));

        assertNull(FieldNormalizers.normalizeCoordinates("north", "-73.99"));
        assertNull(FieldNormalizers.normalizeCoordinates(40.75, null));
        assertNull(FieldNormalizers.normalizeCoordinates(95.0, 10.0));
        assertNull(FieldNormalizers.normalizeCoordinates(Double.NaN, 10.0));
    }
}
