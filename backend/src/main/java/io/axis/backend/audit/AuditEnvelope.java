package io.axis.backend.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Request context stored alongside every action record. {@code requestData} and {@code
 * queryParams} are already redacted. Attributes beyond the fixed fields go into {@link
 * AuditExtensions}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEnvelope(
    String method,
    String path,
    Map<String, Object> queryParams,
    String tenantContext,
    String clientIp,
    String userAgent,
    int statusCode,
    long durationMs,
    Object requestData,
    AuditExtensions extensions) {}
