package io.axis.backend.authorization;

/**
 * The caller on whose behalf an authorization decision is made.
 *
 * @param id stable actor reference (JWT subject); null for anonymous callers
 * @param authenticated whether the caller presented valid credentials
 * @param role the caller's global role; null for anonymous callers
 */
public record Actor(String id, boolean authenticated, ActorRole role) {

  public static final Actor ANONYMOUS = new Actor(null, false, null);

  public static Actor of(String id, ActorRole role) {
    return new Actor(id, true, role != null ? role : ActorRole.MEMBER);
  }

  public boolean isElevated() {
    return authenticated && role != null && role.isElevated();
  }
}
