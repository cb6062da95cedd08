package io.axis.backend.audit;

import java.time.Instant;

/**
 * Query filter for {@link ActionLogService#search}. All fields are nullable; null means no filter
 * on that field.
 *
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record ActionRecordFilter(
    String actorId,
    ActionKind action,
    String entityType,
    String entityId,
    String ipAddress,
    Instant from,
    Instant to) {}
