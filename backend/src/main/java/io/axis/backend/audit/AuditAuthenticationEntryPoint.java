package io.axis.backend.audit;

import io.axis.backend.multitenancy.TenantContextResolver;
import io.axis.backend.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs authentication failures, then lets {@link BearerTokenAuthenticationEntryPoint} write the 401
 * and its {@code WWW-Authenticate} challenge.
 *
 * <p>Failures never reach {@code action_records}: there is no authenticated actor to attribute
 * them to. The log line keeps the client address, user agent and the client context the caller
 * asked for, so repeated failures against one tenant can be traced.
 */
@Component
public class AuditAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AuditAuthenticationEntryPoint.class);

  private final BearerTokenAuthenticationEntryPoint challenge =
      new BearerTokenAuthenticationEntryPoint();

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    log.warn(
        "security.auth_failed: path={}, method={}, client_ip={}, user_agent={}, client={},"
            + " reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ClientIpResolver.resolve(request),
        request.getHeader("User-Agent"),
        TenantContextResolver.resolve(request),
        authException.getMessage());

    challenge.commence(request, response, authException);
  }
}
