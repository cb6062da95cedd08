package io.axis.backend.security;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the client IP address from a servlet request, handling reverse proxy headers. */
public final class ClientIpResolver {

  private ClientIpResolver() {}

  /**
   * Checks X-Forwarded-For (first hop), then X-Real-IP, then falls back to {@code
   * request.getRemoteAddr()}.
   */
  public static String resolve(HttpServletRequest request) {
    return resolve(
        request.getHeader("X-Forwarded-For"),
        request.getHeader("X-Real-IP"),
        request.getRemoteAddr());
  }

  public static String resolve(String forwardedFor, String realIp, String remoteAddr) {
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      String first = forwardedFor.split(",")[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return remoteAddr;
  }
}
