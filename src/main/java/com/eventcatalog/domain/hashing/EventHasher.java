package com.eventcatalog.domain.hashing;

import com.eventcatalog.domain.model.NormalizedEvent;
import com.eventcatalog.domain.normalization.FieldNormalizers;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Content identity of an event.
 *
 * Hash input: {@code title|venue|address|date|time}, where the title is lower-cased
 * and stripped of a trailing " at / @ / - &lt;venue_name&gt;" reference to its own venue,
 * text parts are lower-cased with whitespace collapsed, and the start time is
 * normalized again so 12-hour and 24-hour spellings collapse.
 * The digest is MD5 rendered as 32 lowercase hex characters. It is a
 * fingerprint for deduplication, not a security primitive.
 */
@Component
public class EventHasher {

    static final String SEPARATOR = "|";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> VENUE_SEPARATORS = List.of(" at ", " @ ", " - ");

    public String buildHashInput(NormalizedEvent event) {
        if (event == null) {
            return String.join(SEPARATOR, "", "", "", "", "");
        }
        String venue = canonical(event.venueName());
        String title = stripVenueSuffix(canonical(event.title()), venue);
        String address = canonical(event.address());
        String date = event.eventStartDate() != null ? event.eventStartDate().trim() : "";
        String time = FieldNormalizers.normalizeTime(event.eventStartTime());

        return String.join(SEPARATOR, title, venue, address, date, time != null ? time : "");
    }

    public String generateEventHash(NormalizedEvent event) {
        byte[] input = buildHashInput(event).getBytes(StandardCharsets.UTF_8);
        return DigestUtils.md5DigestAsHex(input);
    }

    public boolean eventsHaveSameHash(NormalizedEvent first, NormalizedEvent second) {
        return generateEventHash(first).equals(generateEventHash(second));
    }

    /**
     * Removes a trailing " at X", " @ X" or " - X" when X is the event's own venue.
     * Both arguments are already canonical, so separators are single spaces.
     */
    static String stripVenueSuffix(String title, String venue) {
        if (venue.isEmpty() || title.length() <= venue.length()) {
            return title;
        }
        for (String separator : VENUE_SEPARATORS) {
            String suffix = separator + venue;
            if (title.endsWith(suffix)) {
                String stripped = title.substring(0, title.length() - suffix.length()).trim();
                return stripped.isEmpty() ? title : stripped;
            }
        }
        return title;
    }

    private static String canonical(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
