package com.eventcatalog.domain.model;

/**
 * Validated event handed to the downstream consumer, carrying its content hash
 * and the validation schema version it passed under.
 * {@code schemaVersion} is null for records stored before versioning existed.
 */
public record CanonicalEvent(String hash, NormalizedEvent event, Integer schemaVersion) {
}
