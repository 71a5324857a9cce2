package io.shogun.api.audit;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the client IP recorded on audit logs, honouring reverse proxy headers. */
final class ClientIpResolver {

  private ClientIpResolver() {}

  /**
   * Returns the first hop of X-Forwarded-For, then X-Real-IP, then {@code getRemoteAddr()}.
   */
  static String resolve(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      return forwardedFor.split(",")[0].trim();
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return request.getRemoteAddr();
  }
}
