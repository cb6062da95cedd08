package io.axis.backend.multitenancy;

import io.axis.backend.authorization.Actor;
import io.axis.backend.authorization.TenantScopeChecker;
import io.axis.backend.security.ActorResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Validates the tenant context an authenticated caller asks for. A caller naming a tenant they hold
 * no active grant for is rejected with 403 before reaching any handler; requests without a tenant
 * context pass through unchanged.
 */
@Component
public class TenantContextFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantContextFilter.class);

  /** Request attribute holding the validated tenant id. */
  public static final String TENANT_CONTEXT_ATTRIBUTE =
      TenantContextFilter.class.getName() + ".TENANT_CONTEXT";

  private final TenantScopeChecker tenantScopeChecker;
  private final ActorResolver actorResolver;

  public TenantContextFilter(TenantScopeChecker tenantScopeChecker, ActorResolver actorResolver) {
    this.tenantScopeChecker = tenantScopeChecker;
    this.actorResolver = actorResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String tenantId = TenantContextResolver.resolve(request);
    Actor actor = actorResolver.currentActor();

    if (tenantId != null && actor.authenticated()) {
      if (!tenantScopeChecker.canAccessTenant(actor, tenantId)) {
        log.warn(
            "security.tenant_denied: path={}, method={}, actor={}, client={}",
            request.getRequestURI(),
            request.getMethod(),
            actor.id(),
            tenantId);
        response.sendError(HttpServletResponse.SC_FORBIDDEN, "No access to client " + tenantId);
        return;
      }
      request.setAttribute(TENANT_CONTEXT_ATTRIBUTE, tenantId);
    }

    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }
}
