package io.axis.backend.changes;

import io.axis.backend.exception.ResourceConflictException;
import java.time.Instant;

/** A change for the same entity was already recorded at the same instant. */
public class ChangeConflictException extends ResourceConflictException {

  public ChangeConflictException(
      String entityType, String entityId, Instant changedAt, Throwable cause) {
    super(
        "Change already recorded",
        "A change for "
            + entityType
            + " "
            + entityId
            + " is already recorded at "
            + changedAt,
        cause);
  }
}
