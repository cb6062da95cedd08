package io.axis.backend.security;

import io.axis.backend.authorization.Actor;
import io.axis.backend.authorization.ActorRole;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Derives the {@link Actor} for the current request from the Spring Security context. */
@Component
public class ActorResolver {

  public Actor currentActor() {
    return fromAuthentication(SecurityContextHolder.getContext().getAuthentication());
  }

  /**
   * Converts an authentication into an actor. Anonymous or unauthenticated principals map to
   * {@link Actor#ANONYMOUS}. When several role authorities are present the highest wins.
   */
  public Actor fromAuthentication(Authentication authentication) {
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return Actor.ANONYMOUS;
    }
    String id =
        authentication instanceof JwtAuthenticationToken jwtAuth
            ? jwtAuth.getToken().getSubject()
            : authentication.getName();
    if (id == null || id.isBlank()) {
      return Actor.ANONYMOUS;
    }

    ActorRole role = ActorRole.MEMBER;
    for (GrantedAuthority authority : authentication.getAuthorities()) {
      var parsed = ActorRole.fromAuthority(authority.getAuthority());
      if (parsed.isPresent() && parsed.get().isAtLeast(role)) {
        role = parsed.get();
      }
    }
    return Actor.of(id, role);
  }
}
