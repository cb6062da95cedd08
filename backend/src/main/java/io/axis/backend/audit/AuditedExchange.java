package io.axis.backend.audit;

import io.axis.backend.authorization.Actor;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;

/**
 * Everything request auditing needs from a finished request/response exchange, captured by {@link
 * AuditFilter} so that {@link AuditInterceptor} stays independent of the servlet API.
 *
 * @param handler the matched handler, or null when none matched
 * @param parsedBody the deserialized request body, if a handler read one
 * @param rawBody the cached raw request bytes, possibly empty
 * @param statusCode the final response status (500 if the handler chain threw)
 */
public record AuditedExchange(
    String method,
    String path,
    Map<String, List<String>> queryParams,
    HttpHeaders headers,
    String clientIp,
    Actor actor,
    Object handler,
    Map<String, String> uriVariables,
    Object parsedBody,
    byte[] rawBody,
    int statusCode,
    long durationMs) {}
