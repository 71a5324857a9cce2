package io.shogun.api.retention;

import io.shogun.api.audit.AuditLog;
import io.shogun.api.audit.AuditLogRepository;
import io.shogun.api.shipping.LogShippingQueue;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;

/**
 * Deletes audit logs that have outlived their category's retention period.
 *
 * <p>Each category is processed in batches: select up to {@code batchSize} logs older than the
 * cutoff, archive them to the shipping sink when enabled, delete them by id and pause for {@code
 * batchDelay} before the next batch. Archive failures are logged and the batch is deleted anyway.
 * Store failures abort the run.
 */
@Service
public class LogRetentionService {

  private static final Logger log = LoggerFactory.getLogger(LogRetentionService.class);

  private final AuditLogRepository auditLogRepository;
  private final LogShippingQueue shippingQueue;
  private final Clock clock;
  private final boolean enabled;
  private final Duration batchDelay;
  private final RetentionPolicyTable policyTable;

  public LogRetentionService(
      AuditLogRepository auditLogRepository,
      LogShippingQueue shippingQueue,
      LogRetentionProperties properties,
      Clock clock) {
    this.auditLogRepository = auditLogRepository;
    this.shippingQueue = shippingQueue;
    this.clock = clock;
    this.enabled = properties.enabled();
    this.batchDelay = properties.batchDelay();
    this.policyTable = RetentionPolicyTable.from(properties);
    log.info(
        "Log retention {}: auth={}d, error={}d, crud={}d, other={}d, batch size {}, archive {}",
        enabled ? "enabled" : "disabled",
        properties.authDays(),
        properties.errorDays(),
        properties.crudDays(),
        properties.defaultDays(),
        policyTable.batchSize(),
        policyTable.archiveBeforeDelete());
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Runs every category's cleanup in the order auth, error, crud, other. Once the thread is
   * interrupted the remaining categories are skipped and count as zero.
   */
  public RetentionCleanupResult runCleanup() {
    if (!enabled) {
      log.warn("Log retention is disabled, skipping cleanup");
      return RetentionCleanupResult.empty();
    }
    log.info("Starting log retention cleanup");
    long startedAt = clock.millis();
    try {
      var result =
          RetentionCleanupResult.of(
              cleanupAuthLogs(), cleanupErrorLogs(), cleanupCrudLogs(), cleanupOtherLogs());
      log.info(
          "Log retention cleanup completed in {}ms: {} logs deleted (auth={}, error={}, crud={},"
              + " other={})",
          clock.millis() - startedAt,
          result.total(),
          result.auth(),
          result.error(),
          result.crud(),
          result.other());
      return result;
    } catch (RuntimeException e) {
      log.error("Log retention cleanup failed: {}", e.getMessage(), e);
      throw e;
    }
  }

  public long cleanupAuthLogs() {
    return cleanupCategory(LogCategory.AUTH);
  }

  public long cleanupErrorLogs() {
    return cleanupCategory(LogCategory.ERROR);
  }

  public long cleanupCrudLogs() {
    return cleanupCategory(LogCategory.CRUD);
  }

  public long cleanupOtherLogs() {
    return cleanupCategory(LogCategory.OTHER);
  }

  /**
   * Deletes every log of the category created before the cutoff, one batch at a time.
   *
   * @return number of logs deleted; fewer than all when the thread is interrupted mid-run
   */
  public long deleteLogsBatch(LogCategory category, Instant cutoff) {
    long totalDeleted = 0;
    while (true) {
      List<AuditLog> batch = selectAged(category, cutoff, Limit.of(policyTable.batchSize()));
      if (batch.isEmpty()) {
        break;
      }
      if (policyTable.archiveBeforeDelete()) {
        archive(category, batch);
      }
      auditLogRepository.deleteAllByIdInBatch(batch.stream().map(AuditLog::getId).toList());
      totalDeleted += batch.size();
      log.debug("Deleted batch of {} {} logs", batch.size(), category.key());
      if (!pauseBetweenBatches()) {
        log.warn(
            "Interrupted while cleaning up {} logs, stopping after {} deletions",
            category.key(),
            totalDeleted);
        break;
      }
    }
    return totalDeleted;
  }

  public RetentionStats getRetentionStats() {
    Instant now = clock.instant();
    var categories = new LinkedHashMap<String, RetentionStats.CategoryStats>();
    for (RetentionPolicy policy : policyTable.policies()) {
      Instant cutoff = cutoffFor(policy, now);
      categories.put(
          policy.category().key(),
          new RetentionStats.CategoryStats(
              policy.retentionDays(), cutoff, countAged(policy.category(), cutoff)));
    }
    return new RetentionStats(
        enabled, categories, auditLogRepository.count(), policyTable.archiveBeforeDelete());
  }

  private long cleanupCategory(LogCategory category) {
    if (Thread.currentThread().isInterrupted()) {
      log.warn("Cleanup interrupted, skipping {} logs", category.key());
      return 0;
    }
    var policy = policyTable.policyFor(category);
    Instant cutoff = cutoffFor(policy, clock.instant());
    long deleted = deleteLogsBatch(category, cutoff);
    log.info(
        "Deleted {} {} logs older than {} days", deleted, category.key(), policy.retentionDays());
    return deleted;
  }

  private void archive(LogCategory category, List<AuditLog> batch) {
    try {
      shippingQueue.archive(batch);
    } catch (RuntimeException e) {
      log.error(
          "Failed to archive {} {} logs before deletion: {}",
          batch.size(),
          category.key(),
          e.getMessage(),
          e);
    }
  }

  private boolean pauseBetweenBatches() {
    if (batchDelay.isZero()) {
      return true;
    }
    try {
      Thread.sleep(batchDelay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private List<AuditLog> selectAged(LogCategory category, Instant cutoff, Limit limit) {
    return switch (category) {
      case AUTH ->
          auditLogRepository.findByCreatedAtBeforeAndActionIn(
              cutoff, LogCategory.AUTH_ACTIONS, limit);
      case ERROR ->
          auditLogRepository.findByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
              cutoff, LogCategory.AUTH_ACTIONS, limit);
      case CRUD ->
          auditLogRepository.findByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
              cutoff, LogCategory.CRUD_ACTIONS, limit);
      case OTHER ->
          auditLogRepository.findByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
              cutoff, LogCategory.AUTH_AND_CRUD_ACTIONS, limit);
    };
  }

  private long countAged(LogCategory category, Instant cutoff) {
    return switch (category) {
      case AUTH ->
          auditLogRepository.countByCreatedAtBeforeAndActionIn(cutoff, LogCategory.AUTH_ACTIONS);
      case ERROR ->
          auditLogRepository.countByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
              cutoff, LogCategory.AUTH_ACTIONS);
      case CRUD ->
          auditLogRepository.countByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
              cutoff, LogCategory.CRUD_ACTIONS);
      case OTHER ->
          auditLogRepository.countByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
              cutoff, LogCategory.AUTH_AND_CRUD_ACTIONS);
    };
  }

  private static Instant cutoffFor(RetentionPolicy policy, Instant now) {
    return now.minus(Duration.ofDays(policy.retentionDays()));
  }
}
