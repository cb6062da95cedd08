package io.axis.backend.changes;

import java.time.Instant;
import java.util.UUID;

/** One step in the history of a single field, joined with its parent change. */
public record FieldHistoryEntry(
    UUID fieldChangeId,
    UUID entityChangeId,
    String fieldName,
    Object oldValue,
    Object newValue,
    ChangeKind changeKind,
    Instant changedAt,
    String changedBy) {}
