package io.axis.backend.audit;

import io.axis.backend.authorization.Actor;
import io.axis.backend.security.ActorResolver;
import io.axis.backend.security.ClientIpResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Servlet adapter for request auditing. Times the request, keeps a copy of the body, and once the
 * chain has finished hands an {@link AuditedExchange} to {@link AuditInterceptor}. Exceptions from
 * the chain propagate unchanged; the exchange then records status 500.
 */
@Component
public class AuditFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(AuditFilter.class);

  private final AuditInterceptor auditInterceptor;
  private final ActorResolver actorResolver;
  private final AuditProperties properties;

  public AuditFilter(
      AuditInterceptor auditInterceptor,
      ActorResolver actorResolver,
      AuditProperties properties) {
    this.auditInterceptor = auditInterceptor;
    this.actorResolver = actorResolver;
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith(properties.apiPrefix());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    long start = System.nanoTime();
    var wrapper = new ContentCachingRequestWrapper(request);
    boolean failed = false;
    try {
      filterChain.doFilter(wrapper, response);
    } catch (IOException | ServletException | RuntimeException e) {
      failed = true;
      throw e;
    } finally {
      long durationMs = (System.nanoTime() - start) / 1_000_000;
      int status = failed ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR : response.getStatus();
      try {
        auditInterceptor.intercept(toExchange(wrapper, status, durationMs));
      } catch (RuntimeException e) {
        log.error(
            "audit.capture_failed: method={}, path={}",
            request.getMethod(),
            request.getRequestURI(),
            e);
      }
    }
  }

  private AuditedExchange toExchange(
      ContentCachingRequestWrapper request, int status, long durationMs) {
    Actor actor = actorResolver.currentActor();
    return new AuditedExchange(
        request.getMethod(),
        request.getRequestURI(),
        queryParams(request.getQueryString()),
        headers(request),
        ClientIpResolver.resolve(request),
        actor,
        request.getAttribute(HandlerMapping.BEST_MATCHING_HANDLER_ATTRIBUTE),
        EntityResolver.uriVariables(request),
        request.getAttribute(AuditRequestBodyAdvice.PARSED_BODY_ATTRIBUTE),
        request.getContentAsByteArray(),
        status,
        durationMs);
  }

  static Map<String, List<String>> queryParams(String queryString) {
    if (queryString == null || queryString.isBlank()) {
      return Map.of();
    }
    var raw = UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams();
    var decoded = new LinkedHashMap<String, List<String>>();
    raw.forEach(
        (name, values) -> {
          var list = new ArrayList<String>(values.size());
          for (String value : values) {
            list.add(value != null ? UriUtils.decode(value, StandardCharsets.UTF_8) : null);
          }
          decoded.put(UriUtils.decode(name, StandardCharsets.UTF_8), list);
        });
    return decoded;
  }

  private static HttpHeaders headers(HttpServletRequest request) {
    var headers = new HttpHeaders();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.put(name, Collections.list(request.getHeaders(name)));
    }
    return headers;
  }
}
