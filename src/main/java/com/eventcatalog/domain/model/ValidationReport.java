package com.eventcatalog.domain.model;

import java.util.List;

/**
 * Result of validating a batch: the valid/invalid partition, its statistics,
 * and the validation schema version the batch was checked under.
 */
public record ValidationReport(
    List<NormalizedEvent> valid,
    List<InvalidEvent> invalid,
    ValidationStats stats,
    int schemaVersion
) {
}
