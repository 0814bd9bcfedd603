package com.eventcatalog.domain.validation;

import com.eventcatalog.domain.model.InvalidEvent;
import com.eventcatalog.domain.model.NormalizedEvent;
import com.eventcatalog.domain.model.RejectReason;
import com.eventcatalog.domain.model.ValidationReport;
import com.eventcatalog.domain.model.ValidationStats;
import com.eventcatalog.domain.model.ValidationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Hard validation of normalized events.
 *
 * Rules are checked in a fixed order and the first failure is reported:
 * <ol>
 *   <li>title present and free of "TBD"</li>
 *   <li>venue name free of "TBD"</li>
 *   <li>venue name or address present</li>
 *   <li>start date present and shaped YYYY-MM-DD</li>
 *   <li>start time present</li>
 *   <li>end time present and free of "TBD"</li>
 * </ol>
 * "TBD" is matched as a case-insensitive substring, not as a word.
 */
@Component
public class EventValidator {

    private static final Logger logger = LoggerFactory.getLogger(EventValidator.class);

    /**
     * Version of the rule set above. Increment whenever a rule changes so that
     * records validated under an older set get re-checked at read time.
     * Version 2 added the end-time requirement.
     */
    public static final int VALIDATION_SCHEMA_VERSION = 2;

    public static final String DEFAULT_PHASE = "VALIDATE";

    private static final String TBD = "tbd";
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final int LOG_TITLE_LENGTH = 40;

    private final boolean logRemovals;
    private final String phase;

    public EventValidator(
            @Value("${events.pipeline.log-removals:true}") boolean logRemovals,
            @Value("${events.pipeline.validation-phase:" + DEFAULT_PHASE + "}") String phase) {
        this.logRemovals = logRemovals;
        this.phase = phase;
    }

    /**
     * Validates one event. A null event is treated as an empty record.
     */
    public ValidationVerdict validateEvent(NormalizedEvent event) {
        if (event == null || isBlank(event.title())) {
            return ValidationVerdict.reject(RejectReason.MISSING_TITLE);
        }
        if (containsTbd(event.title())) {
            return ValidationVerdict.reject(RejectReason.TBD_IN_TITLE);
        }
        if (containsTbd(event.venueName())) {
            return ValidationVerdict.reject(RejectReason.TBD_IN_VENUE);
        }
        if (isBlank(event.venueName()) && isBlank(event.address())) {
            return ValidationVerdict.reject(RejectReason.MISSING_LOCATION);
        }
        if (isBlank(event.eventStartDate())) {
            return ValidationVerdict.reject(RejectReason.MISSING_START_DATE);
        }
        if (!ISO_DATE.matcher(event.eventStartDate()).matches()) {
            return ValidationVerdict.reject(RejectReason.INVALID_DATE_FORMAT);
        }
        if (isBlank(event.eventStartTime())) {
            return ValidationVerdict.reject(RejectReason.MISSING_START_TIME);
        }
        if (isBlank(event.eventEndTime())) {
            return ValidationVerdict.reject(RejectReason.MISSING_END_TIME);
        }
        if (containsTbd(event.eventEndTime())) {
            return ValidationVerdict.reject(RejectReason.TBD_IN_END_TIME);
        }
        return ValidationVerdict.ok();
    }

    /**
     * Partitions a batch into valid and invalid events using the configured logging options.
     */
    public ValidationReport validateEventsHard(List<NormalizedEvent> events) {
        return validateEventsHard(events, logRemovals, phase);
    }

    /**
     * Partitions a batch into valid and invalid events. A null batch yields an empty report.
     *
     * @param logRemovals log each removed event at debug level
     * @param phase       label prefixed to removal log lines
     */
    public ValidationReport validateEventsHard(List<NormalizedEvent> events, boolean logRemovals, String phase) {
        if (events == null) {
            return new ValidationReport(List.of(), List.of(), ValidationStats.empty(), VALIDATION_SCHEMA_VERSION);
        }

        List<NormalizedEvent> valid = new ArrayList<>();
        List<InvalidEvent> invalid = new ArrayList<>();
        Map<RejectReason, Integer> byReason = new EnumMap<>(RejectReason.class);

        for (NormalizedEvent event : events) {
            ValidationVerdict verdict = validateEvent(event);
            if (verdict.valid()) {
                valid.add(event);
                continue;
            }
            invalid.add(new InvalidEvent(event, verdict.reason()));
            byReason.merge(verdict.reason(), 1, Integer::sum);
            if (logRemovals) {
                logger.debug("[{}] Removed ({}): \"{}\"", phase, verdict.reason(), abbreviate(event));
            }
        }

        ValidationStats stats = new ValidationStats(events.size(), valid.size(), invalid.size(),
            Collections.unmodifiableMap(byReason));
        if (!invalid.isEmpty()) {
            logger.info("[{}] Validation: {} -> {} ({} invalid removed) {}",
                phase, stats.total(), stats.valid(), stats.invalid(), byReason);
        }

        return new ValidationReport(List.copyOf(valid), List.copyOf(invalid), stats, VALIDATION_SCHEMA_VERSION);
    }

    /**
     * Whether a record stamped with {@code storedVersion} must be validated again before use.
     * Records without a version predate versioning and always need it.
     */
    public static boolean needsReadTimeValidation(Integer storedVersion) {
        return storedVersion == null || storedVersion < VALIDATION_SCHEMA_VERSION;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean containsTbd(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(TBD);
    }

    private static String abbreviate(NormalizedEvent event) {
        if (event == null || isBlank(event.title())) {
            return "(no title)";
        }
        String title = event.title();
        return title.length() > LOG_TITLE_LENGTH ? title.substring(0, LOG_TITLE_LENGTH) : title;
    }
}
