package io.axis.backend.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.axis.backend.authorization.Actor;
import io.axis.backend.multitenancy.TenantContextResolver;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;

/**
 * Decides whether a finished exchange is audited and turns it into an {@link ActionRecord} for the
 * configured {@link AuditSink}.
 *
 * <p>Only state-changing requests under the API prefix made by authenticated actors are recorded.
 * Auditing never affects the response: every failure while capturing or persisting is logged and
 * discarded.
 */
@Component
@EnableConfigurationProperties(AuditProperties.class)
public class AuditInterceptor {

  private static final Logger log = LoggerFactory.getLogger(AuditInterceptor.class);

  private final AuditProperties properties;
  private final EntityResolver entityResolver;
  private final PayloadRedactor redactor;
  private final AuditSink sink;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AuditInterceptor(
      AuditProperties properties,
      EntityResolver entityResolver,
      PayloadRedactor redactor,
      AuditSink sink,
      ObjectMapper objectMapper,
      Clock clock) {
    this.properties = properties;
    this.entityResolver = entityResolver;
    this.redactor = redactor;
    this.sink = sink;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public boolean shouldAudit(String method, String path, Actor actor) {
    if (method == null || path == null || actor == null || !actor.authenticated()) {
      return false;
    }
    if (!path.startsWith(properties.apiPrefix())) {
      return false;
    }
    String normalized = method.toUpperCase(Locale.ROOT);
    return properties.auditedMethods().stream().anyMatch(normalized::equalsIgnoreCase);
  }

  /** Records the exchange if it qualifies. Never throws. */
  public void intercept(AuditedExchange exchange) {
    try {
      if (!shouldAudit(exchange.method(), exchange.path(), exchange.actor())) {
        return;
      }
      sink.write(capture(exchange));
    } catch (RuntimeException e) {
      log.error(
          "audit.capture_failed: method={}, path={}, actor={}",
          exchange.method(),
          exchange.path(),
          exchange.actor() != null ? exchange.actor().id() : null,
          e);
    }
  }

  ActionRecord capture(AuditedExchange exchange) {
    var entity = entityResolver.resolve(exchange.handler(), exchange.uriVariables());
    HttpHeaders headers = exchange.headers() != null ? exchange.headers() : new HttpHeaders();

    String clientIp = truncate(exchange.clientIp(), properties.maxIpLength());
    String userAgent =
        truncate(headers.getFirst(HttpHeaders.USER_AGENT), properties.maxUserAgentLength());
    String tenantContext =
        TenantContextResolver.resolve(
            headers.getFirst(TenantContextResolver.TENANT_HEADER), exchange.queryParams());

    var envelope =
        new AuditEnvelope(
            exchange.method(),
            exchange.path(),
            redactQueryParams(exchange.queryParams()),
            tenantContext,
            clientIp,
            userAgent,
            exchange.statusCode(),
            exchange.durationMs(),
            redactor.redact(extractBody(exchange)),
            new AuditExtensions(
                describeHandler(exchange.handler()), headers.getFirst(HttpHeaders.CONTENT_TYPE)));

    return new ActionRecord(
        exchange.actor().id(),
        ActionKind.fromHttpMethod(exchange.method()),
        entity.entityType(),
        entity.entityId(),
        envelope,
        clientIp,
        userAgent,
        clock.instant());
  }

  /**
   * Prefers the body the handler deserialized; falls back to parsing the cached bytes as JSON.
   * Bodies that cannot be read as JSON are recorded as an empty map.
   */
  private Object extractBody(AuditedExchange exchange) {
    if (exchange.parsedBody() != null) {
      try {
        return objectMapper.treeToValue(
            objectMapper.valueToTree(exchange.parsedBody()), Object.class);
      } catch (Exception e) {
        log.debug("Could not convert parsed request body: {}", e.toString());
      }
    }
    byte[] raw = exchange.rawBody();
    if (raw != null && raw.length > 0) {
      try {
        return objectMapper.readValue(raw, Object.class);
      } catch (Exception e) {
        log.debug("Request body is not JSON: {}", e.toString());
      }
    }
    return Map.of();
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> redactQueryParams(Map<String, ? extends Object> queryParams) {
    if (queryParams == null || queryParams.isEmpty()) {
      return Map.of();
    }
    Object redacted = redactor.redact(new LinkedHashMap<String, Object>(queryParams));
    return (Map<String, Object>) redacted;
  }

  private static String describeHandler(Object handler) {
    if (handler instanceof HandlerMethod handlerMethod) {
      return handlerMethod.getBeanType().getSimpleName()
          + "#"
          + handlerMethod.getMethod().getName();
    }
    return null;
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
