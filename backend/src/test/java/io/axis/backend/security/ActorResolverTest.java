package io.axis.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.axis.backend.authorization.Actor;
import io.axis.backend.authorization.ActorRole;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class ActorResolverTest {

  private final ActorResolver resolver = new ActorResolver();

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  private static Jwt jwt(String subject) {
    return Jwt.withTokenValue("token")
        .header("alg", "none")
        .subject(subject)
        .issuedAt(Instant.now())
        .expiresAt(Instant.now().plusSeconds(300))
        .build();
  }

  @Test
  void noAuthentication_isAnonymous() {
    assertThat(resolver.currentActor()).isEqualTo(Actor.ANONYMOUS);
  }

  @Test
  void anonymousToken_isAnonymous() {
    var anonymous =
        new AnonymousAuthenticationToken(
            "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

    assertThat(resolver.fromAuthentication(anonymous)).isEqualTo(Actor.ANONYMOUS);
  }

  @Test
  void jwtSubjectAndRole_becomeActor() {
    var token =
        new JwtAuthenticationToken(
            jwt("user_42"), List.of(new SimpleGrantedAuthority("ROLE_MANAGER")));
    SecurityContextHolder.getContext().setAuthentication(token);

    var actor = resolver.currentActor();

    assertThat(actor.id()).isEqualTo("user_42");
    assertThat(actor.authenticated()).isTrue();
    assertThat(actor.role()).isEqualTo(ActorRole.MANAGER);
    assertThat(actor.isElevated()).isTrue();
  }

  @Test
  void highestRoleWins_andUnknownAuthoritiesAreIgnored() {
    var token =
        new JwtAuthenticationToken(
            jwt("user_7"),
            List.of(
                new SimpleGrantedAuthority("SCOPE_read"),
                new SimpleGrantedAuthority("ROLE_ADMIN"),
                new SimpleGrantedAuthority("ROLE_STAFF")));

    assertThat(resolver.fromAuthentication(token).role()).isEqualTo(ActorRole.ADMIN);
  }

  @Test
  void noRoleAuthority_defaultsToMember() {
    var token = new JwtAuthenticationToken(jwt("user_8"), List.of());

    var actor = resolver.fromAuthentication(token);

    assertThat(actor.role()).isEqualTo(ActorRole.MEMBER);
    assertThat(actor.isElevated()).isFalse();
  }

  @Test
  void unauthenticatedToken_isAnonymous() {
    var token = new TestingAuthenticationToken("user_9", "n/a");
    token.setAuthenticated(false);

    assertThat(resolver.fromAuthentication(token)).isEqualTo(Actor.ANONYMOUS);
  }
}
