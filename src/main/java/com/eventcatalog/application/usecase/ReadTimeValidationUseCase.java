package com.eventcatalog.application.usecase;

import com.eventcatalog.domain.hashing.EventHasher;
import com.eventcatalog.domain.model.CanonicalEvent;
import com.eventcatalog.domain.model.InvalidEvent;
import com.eventcatalog.domain.model.ValidationVerdict;
import com.eventcatalog.domain.ports.EventHashStore;
import com.eventcatalog.domain.validation.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Use case for trusting stored events at read time.
 *
 * Records stamped with the current validation schema version are passed through.
 * Older or unstamped records are validated again; those that pass are re-stamped
 * and written back to the hash store, those that fail are withheld with their reason.
 * Stored data is never migrated in bulk.
 */
@Service
public class ReadTimeValidationUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ReadTimeValidationUseCase.class);

    private final EventValidator validator;
    private final EventHasher hasher;
    private final EventHashStore hashStore;

    public ReadTimeValidationUseCase(EventValidator validator, EventHasher hasher, EventHashStore hashStore) {
        this.validator = validator;
        this.hasher = hasher;
        this.hashStore = hashStore;
    }

    public ReadTimeResult execute(List<CanonicalEvent> storedEvents) {
        if (storedEvents == null || storedEvents.isEmpty()) {
            return new ReadTimeResult(List.of(), List.of(), 0);
        }

        List<CanonicalEvent> trusted = new ArrayList<>();
        List<InvalidEvent> rejected = new ArrayList<>();
        int revalidated = 0;

        for (CanonicalEvent stored : storedEvents) {
            if (stored == null) {
                continue;
            }
            if (!EventValidator.needsReadTimeValidation(stored.schemaVersion())) {
                trusted.add(stored);
                continue;
            }

            revalidated++;
            ValidationVerdict verdict = validator.validateEvent(stored.event());
            if (!verdict.valid()) {
                rejected.add(new InvalidEvent(stored.event(), verdict.reason()));
                continue;
            }

            String hash = stored.hash() != null ? stored.hash() : hasher.generateEventHash(stored.event());
            CanonicalEvent restamped = new CanonicalEvent(hash, stored.event(), EventValidator.VALIDATION_SCHEMA_VERSION);
            hashStore.put(restamped);
            trusted.add(restamped);
        }

        if (revalidated > 0) {
            logger.info("Read-time validation: {} of {} stored events re-checked, {} withheld",
                revalidated, storedEvents.size(), rejected.size());
        }

        return new ReadTimeResult(List.copyOf(trusted), List.copyOf(rejected), revalidated);
    }

    /**
     * @param trusted     events safe to hand downstream, stamped with the current version
     * @param rejected    stored events that fail the current rules
     * @param revalidated how many stored events had to be validated again
     */
    public record ReadTimeResult(List<CanonicalEvent> trusted, List<InvalidEvent> rejected, int revalidated) {}
}
