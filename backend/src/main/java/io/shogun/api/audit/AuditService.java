package io.shogun.api.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Service interface for recording and querying audit logs. Recording never depends on the
 * external log sink: shipping happens after commit on a detached task.
 */
public interface AuditService {

  /**
   * Persists a single audit log within the current transaction and schedules it for shipping once
   * the transaction commits.
   *
   * @param record the audit data to persist
   * @return the saved audit log with its generated id
   */
  AuditLog log(AuditLogRecord record);

  Page<AuditLog> findAll(AuditLogFilter filter, Pageable pageable);

  Page<AuditLog> findByEntity(String entityType, String entityId, Pageable pageable);

  AuditLog findById(UUID id);

  /**
   * Counts audit logs in {@code [from, to)} grouped by action, entity type and user.
   *
   * @throws IllegalArgumentException if {@code from} is not before {@code to}
   */
  AuditStatistics getStatistics(Instant from, Instant to);
}
