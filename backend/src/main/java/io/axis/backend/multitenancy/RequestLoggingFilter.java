package io.axis.backend.multitenancy;

import io.axis.backend.authorization.Actor;
import io.axis.backend.security.ActorResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_ACTOR_ID = "actorId";
  static final String MDC_CLIENT_ID = "clientId";

  private final ActorResolver actorResolver;

  public RequestLoggingFilter(ActorResolver actorResolver) {
    this.actorResolver = actorResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Actor actor = actorResolver.currentActor();
      if (actor.authenticated()) {
        MDC.put(MDC_ACTOR_ID, actor.id());
      }

      Object clientId = request.getAttribute(TenantContextFilter.TENANT_CONTEXT_ATTRIBUTE);
      if (clientId != null) {
        MDC.put(MDC_CLIENT_ID, clientId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_CLIENT_ID);
      MDC.remove(MDC_ACTOR_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
