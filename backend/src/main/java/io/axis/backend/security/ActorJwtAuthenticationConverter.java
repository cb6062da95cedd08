package io.axis.backend.security;

import io.axis.backend.authorization.ActorRole;
import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Maps the {@code role} claim of the bearer token to a single {@code ROLE_*} authority. Tokens
 * without a recognised role authenticate as {@link ActorRole#MEMBER}.
 */
@Component
public class ActorJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLE_CLAIM = "role";

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    var role = ActorRole.fromClaim(jwt.getClaimAsString(ROLE_CLAIM)).orElse(ActorRole.MEMBER);
    return List.of(new SimpleGrantedAuthority(role.authority()));
  }
}
