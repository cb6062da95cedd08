package io.axis.backend.changes;

import java.time.Instant;

/**
 * Query filter for {@link ChangeStore#search}. All fields are nullable; null means no filter on
 * that field.
 *
 * @param changedBy actor reference that made the change
 * @param active filter on the record's active flag
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record EntityChangeFilter(
    String entityType,
    String entityId,
    String changedBy,
    ChangeKind changeKind,
    Boolean active,
    Instant from,
    Instant to) {}
