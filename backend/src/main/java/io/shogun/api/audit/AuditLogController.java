package io.shogun.api.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit-logs")
public class AuditLogController {

  private static final int MAX_PAGE_SIZE = 200;

  private final AuditService auditService;

  public AuditLogController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping
  public ResponseEntity<Page<AuditLogResponse>> listAuditLogs(
      @RequestParam(required = false) Long userId,
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) String action,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {

    var filter = new AuditLogFilter(userId, entityType, action, from, to);
    var logs = auditService.findAll(filter, pageable(page, size));
    return ResponseEntity.ok(logs.map(AuditLogResponse::from));
  }

  @GetMapping("/{id}")
  public ResponseEntity<AuditLogResponse> getAuditLog(@PathVariable UUID id) {
    return ResponseEntity.ok(AuditLogResponse.from(auditService.findById(id)));
  }

  @GetMapping("/entity/{entityType}/{entityId}")
  public ResponseEntity<Page<AuditLogResponse>> listAuditLogsByEntity(
      @PathVariable String entityType,
      @PathVariable String entityId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {

    var logs = auditService.findByEntity(entityType, entityId, pageable(page, size));
    return ResponseEntity.ok(logs.map(AuditLogResponse::from));
  }

  @GetMapping("/statistics")
  public ResponseEntity<AuditStatistics> getStatistics(
      @RequestParam Instant from, @RequestParam Instant to) {
    return ResponseEntity.ok(auditService.getStatistics(from, to));
  }

  private static PageRequest pageable(int page, int size) {
    return PageRequest.of(
        Math.max(page, 0),
        Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
        Sort.by(Sort.Direction.DESC, "createdAt"));
  }

  // --- DTO ---

  public record AuditLogResponse(
      UUID id,
      Long userId,
      String username,
      String action,
      String entityType,
      String entityId,
      Map<String, Object> changes,
      String ipAddress,
      String userAgent,
      String method,
      String endpoint,
      Integer statusCode,
      String errorMessage,
      Map<String, Object> metadata,
      Instant createdAt) {

    public static AuditLogResponse from(AuditLog log) {
      return new AuditLogResponse(
          log.getId(),
          log.getUserId(),
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
          log.getCreatedAt());
    }
  }
}
