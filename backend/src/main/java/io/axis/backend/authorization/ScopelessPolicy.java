package io.axis.backend.authorization;

/** Read decision for non-elevated actors when an object has no discoverable tenant scope. */
public enum ScopelessPolicy {
  ALLOW,
  DENY
}
