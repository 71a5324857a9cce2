package io.shogun.api.shipping;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shogun.api.audit.AuditLog;
import java.util.Map;

/** Wire shape of one audit log in an Axiom ingest request. */
public record AxiomLogEvent(
    @JsonProperty("_time") String time,
    @JsonProperty("id") String id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("username") String username,
    @JsonProperty("action") String action,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("changes") Map<String, Object> changes,
    @JsonProperty("ip_address") String ipAddress,
    @JsonProperty("user_agent") String userAgent,
    @JsonProperty("method") String method,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("status_code") Integer statusCode,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("environment") String environment,
    @JsonProperty("service") String service) {

  public static final String SERVICE_NAME = "shogun-api";

  public static AxiomLogEvent from(AuditLog log, String environment) {
    return new AxiomLogEvent(
        log.getCreatedAt().toString(),
        log.getId() != null ? log.getId().toString() : null,
        log.getUserId() != null ? String.valueOf(log.getUserId()) : null,
        log.getUsername(),
        log.getAction(),
        log.getEntityType(),
        log.getEntityId(),
        log.getChanges(),
        log.getIpAddress(),
        log.getUserAgent(),
        log.getMethod(),
        log.getEndpoint(),
        log.getStatusCode(),
        log.getErrorMessage(),
        log.getMetadata(),
        environment,
        SERVICE_NAME);
  }
}
