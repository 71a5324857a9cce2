package io.shogun.api.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.security.Principal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Records an audit log for every authenticated mutating request (POST, PUT, PATCH, DELETE).
 * Successful requests are recorded as {@code CREATE}, {@code UPDATE} or {@code DELETE}; requests
 * whose handler threw are recorded as {@code <ACTION>_FAILED} with the exception message.
 *
 * <p>Recording is best-effort: a failure to write the audit log is logged and never changes the
 * response.
 */
@Component
public class AuditLoggingInterceptor implements HandlerInterceptor {

  private static final Logger log = LoggerFactory.getLogger(AuditLoggingInterceptor.class);

  static final String START_TIME_ATTRIBUTE = AuditLoggingInterceptor.class.getName() + ".start";

  private static final Set<String> AUDITED_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

  private final AuditService auditService;

  public AuditLoggingInterceptor(AuditService auditService) {
    this.auditService = auditService;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    Principal principal = request.getUserPrincipal();
    if (principal == null || !AUDITED_METHODS.contains(request.getMethod())) {
      return;
    }

    Throwable failure = ex;
    if (failure == null
        && request.getAttribute(DispatcherServlet.EXCEPTION_ATTRIBUTE) instanceof Throwable t) {
      failure = t;
    }

    try {
      String action = actionFor(request.getMethod());
      int status = ex != null ? 500 : response.getStatus();
      var metadata = new HashMap<String, Object>();
      if (request.getAttribute(START_TIME_ATTRIBUTE) instanceof Long start) {
        metadata.put("duration", System.currentTimeMillis() - start);
      }

      List<String> segments = pathSegments(request.getRequestURI());
      auditService.log(
          AuditLogBuilder.builder()
              .userId(parseUserId(principal.getName()))
              .username(principal.getName())
              .action(failure != null ? action + "_FAILED" : action)
              .entityType(entityTypeFrom(segments))
              .entityId(segments.size() > 1 ? segments.get(1) : null)
              .changes("DELETE".equals(request.getMethod()) ? Map.of("deleted", true) : null)
              .request(request)
              .statusCode(status)
              .errorMessage(failure != null ? errorMessageOf(failure) : null)
              .metadata(metadata)
              .build());
    } catch (Exception e) {
      log.warn(
          "Failed to record audit log for {} {}: {}",
          request.getMethod(),
          request.getRequestURI(),
          e.getMessage());
    }
  }

  static String actionFor(String method) {
    return switch (method) {
      case "POST" -> "CREATE";
      case "PUT", "PATCH" -> "UPDATE";
      case "DELETE" -> "DELETE";
      default -> method;
    };
  }

  /** Path segments with a leading {@code api} prefix removed. */
  static List<String> pathSegments(String uri) {
    var segments = Arrays.stream(uri.split("/")).filter(s -> !s.isBlank()).toList();
    if (!segments.isEmpty() && "api".equals(segments.get(0))) {
      return segments.subList(1, segments.size());
    }
    return segments;
  }

  /** "projects" becomes "Project", "playlists" becomes "Playlist". */
  static String entityTypeFrom(List<String> segments) {
    if (segments.isEmpty()) {
      return "Unknown";
    }
    String segment = segments.get(0);
    if (segment.length() > 1 && segment.endsWith("s")) {
      segment = segment.substring(0, segment.length() - 1);
    }
    return Character.toUpperCase(segment.charAt(0)) + segment.substring(1);
  }

  private static Long parseUserId(String name) {
    try {
      return Long.valueOf(name);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String errorMessageOf(Throwable failure) {
    return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
  }
}
