package io.shogun.api.shipping;

import io.shogun.api.audit.AuditLog;
import io.shogun.api.audit.AuditLogCreatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands persisted audit logs to the shipping queue once their transaction commits. Shipping runs
 * on the pipeline scheduler so a slow sink never holds up the request that produced the log, and
 * any failure is logged rather than surfaced to it.
 */
@Component
public class AuditLogShippingListener {

  private static final Logger log = LoggerFactory.getLogger(AuditLogShippingListener.class);

  private final LogShippingQueue shippingQueue;
  private final TaskExecutor executor;

  public AuditLogShippingListener(
      LogShippingQueue shippingQueue,
      @Qualifier("auditPipelineScheduler") TaskExecutor executor) {
    this.shippingQueue = shippingQueue;
    this.executor = executor;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onAuditLogCreated(AuditLogCreatedEvent event) {
    try {
      executor.execute(() -> ship(event.auditLog()));
    } catch (TaskRejectedException e) {
      log.warn(
          "Could not schedule shipping for audit log {}: {}",
          event.auditLog().getId(),
          e.getMessage());
    }
  }

  private void ship(AuditLog auditLog) {
    try {
      shippingQueue.enqueue(auditLog);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to enqueue audit log {} for shipping: {}", auditLog.getId(), e.getMessage(), e);
    }
  }
}
