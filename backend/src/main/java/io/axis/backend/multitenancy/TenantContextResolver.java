package io.axis.backend.multitenancy;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;

/**
 * Reads the tenant (client) the caller claims to be acting for. The {@code X-Client-ID} header
 * takes precedence over the {@code client_id} query parameter.
 */
public final class TenantContextResolver {

  public static final String TENANT_HEADER = "X-Client-ID";
  public static final String TENANT_QUERY_PARAM = "client_id";

  private TenantContextResolver() {}

  public static String resolve(HttpServletRequest request) {
    return resolve(request.getHeader(TENANT_HEADER), request.getParameter(TENANT_QUERY_PARAM));
  }

  /** Variant for already-captured request data. Returns null when neither source is set. */
  public static String resolve(String headerValue, Map<String, List<String>> queryParams) {
    String param = null;
    if (queryParams != null) {
      List<String> values = queryParams.get(TENANT_QUERY_PARAM);
      if (values != null && !values.isEmpty()) {
        param = values.get(0);
      }
    }
    return resolve(headerValue, param);
  }

  private static String resolve(String headerValue, String paramValue) {
    if (headerValue != null && !headerValue.isBlank()) {
      return headerValue.trim();
    }
    if (paramValue != null && !paramValue.isBlank()) {
      return paramValue.trim();
    }
    return null;
  }
}
