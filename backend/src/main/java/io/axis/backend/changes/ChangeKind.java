package io.axis.backend.changes;

/** Lifecycle transition recorded in the change history. */
public enum ChangeKind {
  CREATE,
  UPDATE,
  DELETE,
  RESTORE,
  ARCHIVE,
  UNARCHIVE,
  DEACTIVATE,
  ACTIVATE
}
