package io.shogun.api.audit;

import io.shogun.api.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}. Delegates persistence and querying to
 * {@link AuditLogRepository}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction. The {@link
 * AuditLogCreatedEvent} it publishes is handled after commit, so a rolled-back audit log is never
 * shipped.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditLogRepository auditLogRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public DatabaseAuditService(
      AuditLogRepository auditLogRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.auditLogRepository = auditLogRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Override
  @Transactional
  public AuditLog log(AuditLogRecord record) {
    var saved = auditLogRepository.save(new AuditLog(record, clock.instant()));
    log.debug(
        "Recorded audit log: action={}, entity={}/{}, user={}",
        record.action(),
        record.entityType(),
        record.entityId(),
        record.userId());
    eventPublisher.publishEvent(new AuditLogCreatedEvent(saved));
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditLog> findAll(AuditLogFilter filter, Pageable pageable) {
    return auditLogRepository.findByFilter(
        filter.userId(),
        filter.entityType(),
        filter.action(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditLog> findByEntity(String entityType, String entityId, Pageable pageable) {
    return auditLogRepository.findByEntityTypeAndEntityId(entityType, entityId, pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public AuditLog findById(UUID id) {
    return auditLogRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Audit log", id));
  }

  @Override
  @Transactional(readOnly = true)
  public AuditStatistics getStatistics(Instant from, Instant to) {
    if (from == null || to == null || !from.isBefore(to)) {
      throw new IllegalArgumentException("'from' must be before 'to'");
    }
    long total = auditLogRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(from, to);
    return new AuditStatistics(
        total,
        toMap(auditLogRepository.countByAction(from, to)),
        toMap(auditLogRepository.countByEntityType(from, to)),
        toMap(auditLogRepository.countByUser(from, to)),
        new AuditStatistics.Period(from, to));
  }

  private static Map<String, Long> toMap(List<AuditLogRepository.LabelCount> counts) {
    var map = new LinkedHashMap<String, Long>();
    counts.forEach(c -> map.put(c.getLabel(), c.getCount()));
    return map;
  }
}
