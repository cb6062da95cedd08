package io.axis.backend.authorization;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed, ordered set of actor roles. Declaration order is privilege order: a role is "at least"
 * every role declared before it. Roles from {@link #MANAGER} upward are elevated and bypass tenant
 * scope checks.
 *
 * <p>The JWT {@code role} claim carries the lower-case name (e.g. {@code "manager"}); Spring
 * Security sees the {@code ROLE_} prefixed upper-case authority (e.g. {@code ROLE_MANAGER}).
 */
public enum ActorRole {
  MEMBER,
  STAFF,
  MANAGER,
  ADMIN,
  SUPERUSER;

  private static final String AUTHORITY_PREFIX = "ROLE_";

  public boolean isAtLeast(ActorRole other) {
    return compareTo(other) >= 0;
  }

  public boolean isElevated() {
    return isAtLeast(MANAGER);
  }

  public String authority() {
    return AUTHORITY_PREFIX + name();
  }

  /** Parses a JWT claim value. Unknown or blank values yield empty. */
  public static Optional<ActorRole> fromClaim(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /** Parses a Spring Security authority such as {@code ROLE_ADMIN}. */
  public static Optional<ActorRole> fromAuthority(String authority) {
    if (authority == null || !authority.startsWith(AUTHORITY_PREFIX)) {
      return Optional.empty();
    }
    return fromClaim(authority.substring(AUTHORITY_PREFIX.length()));
  }
}
