package io.axis.backend.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Typed extension slot of the {@link AuditEnvelope}. New attributes are added here as nullable
 * components; stored envelopes written before a component existed read it back as {@code null},
 * and attributes unknown to this version are ignored.
 *
 * @param handler the matched controller method as {@code SimpleClassName#method}, or null when the
 *     request never reached a handler
 * @param contentType the request's {@code Content-Type}, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditExtensions(String handler, String contentType) {

  public static final AuditExtensions NONE = new AuditExtensions(null, null);
}
