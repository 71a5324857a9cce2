package io.shogun.api.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditLogRecord}. Request context fields (IP address, user
 * agent, method and endpoint) are taken from the current HTTP request when one is bound and the
 * caller has not set them explicitly.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditLogRecord record = AuditLogBuilder.builder()
 *     .userId(user.getId())
 *     .username(user.getName())
 *     .action("LOGIN")
 *     .entityType("User")
 *     .entityId(String.valueOf(user.getId()))
 *     .build();
 * }</pre>
 *
 * <p>String fields are cut to the lengths of their {@code audit_logs} columns, so an oversized
 * header or path never makes the insert fail.
 */
public class AuditLogBuilder {

  static final int MAX_USERNAME_LENGTH = 255;
  static final int MAX_ACTION_LENGTH = 50;
  static final int MAX_ENTITY_TYPE_LENGTH = 100;
  static final int MAX_ENTITY_ID_LENGTH = 255;
  static final int MAX_IP_ADDRESS_LENGTH = 45;
  static final int MAX_USER_AGENT_LENGTH = 500;
  static final int MAX_METHOD_LENGTH = 10;
  static final int MAX_ENDPOINT_LENGTH = 500;

  private Long userId;
  private String username;
  private String action;
  private String entityType;
  private String entityId;
  private Map<String, Object> changes;
  private String ipAddress;
  private String userAgent;
  private String method;
  private String endpoint;
  private Integer statusCode;
  private String errorMessage;
  private Map<String, Object> metadata;

  private boolean requestContextExplicitlySet;

  private AuditLogBuilder() {}

  public static AuditLogBuilder builder() {
    return new AuditLogBuilder();
  }

  public AuditLogBuilder userId(Long userId) {
    this.userId = userId;
    return this;
  }

  public AuditLogBuilder username(String username) {
    this.username = username;
    return this;
  }

  public AuditLogBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditLogBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditLogBuilder entityId(String entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditLogBuilder changes(Map<String, Object> changes) {
    this.changes = changes;
    return this;
  }

  public AuditLogBuilder statusCode(Integer statusCode) {
    this.statusCode = statusCode;
    return this;
  }

  public AuditLogBuilder errorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
    return this;
  }

  public AuditLogBuilder metadata(Map<String, Object> metadata) {
    this.metadata = metadata;
    return this;
  }

  /** Sets the request context from the given request instead of the thread-bound one. */
  public AuditLogBuilder request(HttpServletRequest request) {
    this.ipAddress = ClientIpResolver.resolve(request);
    this.userAgent = request.getHeader("User-Agent");
    this.method = request.getMethod();
    this.endpoint = request.getRequestURI();
    this.requestContextExplicitlySet = true;
    return this;
  }

  /**
   * Builds the record. {@code action} is required; when no request was set explicitly the
   * thread-bound servlet request, if any, supplies the request context fields.
   */
  public AuditLogRecord build() {
    if (action == null || action.isBlank()) {
      throw new IllegalStateException("action is required");
    }
    if (!requestContextExplicitlySet) {
      HttpServletRequest current = resolveHttpRequest();
      if (current != null) {
        request(current);
      }
    }
    return new AuditLogRecord(
        userId,
        truncate(username, MAX_USERNAME_LENGTH),
        truncate(action, MAX_ACTION_LENGTH),
        truncate(entityType, MAX_ENTITY_TYPE_LENGTH),
        truncate(entityId, MAX_ENTITY_ID_LENGTH),
        changes,
        truncate(ipAddress, MAX_IP_ADDRESS_LENGTH),
        truncate(userAgent, MAX_USER_AGENT_LENGTH),
        truncate(method, MAX_METHOD_LENGTH),
        truncate(endpoint, MAX_ENDPOINT_LENGTH),
        statusCode,
        errorMessage,
        metadata);
  }

  private static String truncate(String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      return value.substring(0, maxLength);
    }
    return value;
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
