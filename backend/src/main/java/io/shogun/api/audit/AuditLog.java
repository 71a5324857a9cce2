package io.shogun.api.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable audit log entry persisted to the {@code audit_logs} table. Rows are only ever
 * inserted, shipped to the log sink and eventually deleted by the retention cleanup; there are
 * no setters and {@code createdAt} is not updatable.
 *
 * @see AuditLogRecord
 * @see io.shogun.api.retention.LogCategory
 */
@Entity
@Table(name = "audit_logs")
public class AuditLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id")
  private Long userId;

  @Column(name = "username", length = 255)
  private String username;

  @Column(name = "action", nullable = false, length = 50)
  private String action;

  @Column(name = "entity_type", length = 100)
  private String entityType;

  @Column(name = "entity_id", length = 255)
  private String entityId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "changes", columnDefinition = "jsonb")
  private Map<String, Object> changes;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @Column(name = "method", length = 10)
  private String method;

  @Column(name = "endpoint", length = 500)
  private String endpoint;

  @Column(name = "status_code")
  private Integer statusCode;

  @Column(name = "error_message", columnDefinition = "text")
  private String errorMessage;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private Map<String, Object> metadata;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** Protected no-arg constructor required by JPA. */
  protected AuditLog() {}

  /** Creates an audit log from the given record, stamped with the given creation instant. */
  public AuditLog(AuditLogRecord record, Instant createdAt) {
    this.userId = record.userId();
    this.username = record.username();
    this.action = record.action();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.changes = record.changes();
    this.ipAddress = record.ipAddress();
    this.userAgent = record.userAgent();
    this.method = record.method();
    this.endpoint = record.endpoint();
    this.statusCode = record.statusCode();
    this.errorMessage = record.errorMessage();
    this.metadata = record.metadata();
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public String getUsername() {
    return username;
  }

  public String getAction() {
    return action;
  }

  public String getEntityType() {
    return entityType;
  }

  public String getEntityId() {
    return entityId;
  }

  public Map<String, Object> getChanges() {
    return changes;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public String getMethod() {
    return method;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
