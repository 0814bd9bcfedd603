package com.eventcatalog.domain.normalization;

import com.eventcatalog.domain.model.AttendanceLevel;
import com.eventcatalog.domain.model.Coordinates;
import com.eventcatalog.domain.model.EventCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field-level normalization rules for provider event data.
 *
 * Every method is pure and lenient: input that cannot be represented comes back
 * as an empty string, null or {@link EventCategory#OTHER}, never as an exception.
 * Every method is also idempotent on its own output.
 */
public final class FieldNormalizers {

    private static final Logger logger = LoggerFactory.getLogger(FieldNormalizers.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern SLASH_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");
    private static final Pattern TIME_24H = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");
    private static final Pattern TIME_LOOSE = Pattern.compile(
        "^(\\d{1,2})(?::(\\d{2}))?\\s*(?:([AaPp])\\.?\\s*[Mm]\\.?)?$");

    private static final DateTimeFormatter SLASH_DATE_FORMAT = DateTimeFormatter
        .ofPattern("M/d/uuuu", Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);

    private static final List<DateTimeFormatter> MONTH_NAME_FORMATS = List.of(
        monthNameFormat("MMMM d[,] uuuu"),
        monthNameFormat("MMM d[,] uuuu")
    );

    /** Opening quote to the closing quote that pairs with it. */
    private static final Map<Character, Character> QUOTE_PAIRS = Map.of(
        '"', '"',
        '\'', '\'',
        '“', '”',
        '‘', '’'
    );

    private static final int COORDINATE_SCALE = 6;

    private FieldNormalizers() {
    }

    private static DateTimeFormatter monthNameFormat(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Strips surrounding matching quotes (straight or curly), collapses whitespace and trims.
     * Quote layers are removed until the ends no longer pair, so the result is stable
     * when normalized again.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String result = title.trim();
        while (result.length() >= 2) {
            Character closing = QUOTE_PAIRS.get(result.charAt(0));
            if (closing == null || result.charAt(result.length() - 1) != closing) {
                break;
            }
            result = result.substring(1, result.length() - 1).trim();
        }
        return WHITESPACE.matcher(result).replaceAll(" ");
    }

    /**
     * Extracts the venue from a "Venue Name, Street Address" string.
     */
    public static String normalizeVenueName(String venue) {
        if (venue == null) {
            return "";
        }
        int comma = venue.indexOf(',');
        return (comma >= 0 ? venue.substring(0, comma) : venue).trim();
    }

    /**
     * Normalizes a date to YYYY-MM-DD.
     *
     * Accepted shapes, tried in order: YYYY-MM-DD (passed through), M/D/YYYY,
     * and English "Month D, YYYY" (full or abbreviated month, comma optional).
     *
     * @return the ISO date, or null when the input is blank or matches no shape
     */
    public static String normalizeDate(String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        String trimmed = WHITESPACE.matcher(date.trim()).replaceAll(" ");

        if (ISO_DATE.matcher(trimmed).matches()) {
            return trimmed;
        }

        if (SLASH_DATE.matcher(trimmed).matches()) {
            return parseDate(trimmed, SLASH_DATE_FORMAT);
        }

        for (DateTimeFormatter format : MONTH_NAME_FORMATS) {
            String parsed = parseDate(trimmed, format);
            if (parsed != null) {
                return parsed;
            }
        }

        logger.debug("Unparseable date '{}'", date);
        return null;
    }

    private static String parseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format).format(DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            logger.trace("Date '{}' does not match {}: {}", text, format, e.getMessage());
            return null;
        }
    }

    /**
     * Normalizes a time to 24-hour HH:MM.
     *
     * Accepts HH:MM (passed through) and 12-hour forms such as "7 PM", "7:30pm" or "7PM".
     * 12 AM becomes 00:00 and 12 PM stays 12:00; minutes default to 00.
     *
     * @return the time, or null when the input is blank or out of range
     */
    public static String normalizeTime(String time) {
        if (time == null || time.isBlank()) {
            return null;
        }
        String trimmed = time.trim();

        if (TIME_24H.matcher(trimmed).matches()) {
            return trimmed;
        }

        Matcher match = TIME_LOOSE.matcher(trimmed);
        if (!match.matches()) {
            logger.debug("Unparseable time '{}'", time);
            return null;
        }

        int hour = Integer.parseInt(match.group(1));
        int minute = match.group(2) != null ? Integer.parseInt(match.group(2)) : 0;
        String period = match.group(3);

        if (minute > 59) {
            return null;
        }
        if (period != null) {
            if (hour < 1 || hour > 12) {
                return null;
            }
            boolean pm = period.equalsIgnoreCase("p");
            if (pm && hour != 12) {
                hour += 12;
            } else if (!pm && hour == 12) {
                hour = 0;
            }
        } else if (hour > 23) {
            return null;
        }

        return String.format("%02d:%02d", hour, minute);
    }

    /**
     * Maps a free-text category hint onto the closed category set.
     */
    public static EventCategory normalizeCategory(String category) {
        return EventCategory.fromHint(category);
    }

    /**
     * Recognizes high/medium/low case-insensitively; anything else is absent.
     */
    public static AttendanceLevel normalizeAttendance(String attendance) {
        return AttendanceLevel.fromValue(attendance);
    }

    /**
     * Builds coordinates from numeric or numeric-string values.
     *
     * @return coordinates rounded to 6 decimals, or null when either value is
     *         missing, non-numeric or outside the valid latitude/longitude range
     */
    public static Coordinates normalizeCoordinates(Object lat, Object lng) {
        Double latitude = toDouble(lat);
        Double longitude = toDouble(lng);
        if (latitude == null || longitude == null) {
            return null;
        }
        if (Math.abs(latitude) > 90 || Math.abs(longitude) > 180) {
            logger.debug("Coordinates out of range: {}, {}", latitude, longitude);
            return null;
        }
        return new Coordinates(round(latitude), round(longitude));
    }

    private static Double toDouble(Object value) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof CharSequence chars && !chars.toString().isBlank()) {
            try {
                parsed = Double.parseDouble(chars.toString().trim());
            } catch (NumberFormatException e) {
                logger.debug("Non-numeric coordinate '{}'", value);
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
