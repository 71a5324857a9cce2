package io.shogun.api.shipping;

import static io.shogun.api.audit.AuditLogFixtures.auditLog;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.shogun.api.audit.AuditLogCreatedEvent;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class AuditLogShippingListenerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-15T10:00:00Z");

  @Mock private LogShippingQueue shippingQueue;

  @Test
  void onAuditLogCreated_enqueuesSavedLog() {
    var listener = new AuditLogShippingListener(shippingQueue, new SyncTaskExecutor());
    var log = auditLog("CREATE", null, CREATED_AT);

    listener.onAuditLogCreated(new AuditLogCreatedEvent(log));

    verify(shippingQueue).enqueue(log);
  }

  @Test
  void onAuditLogCreated_enqueueFailure_isSwallowed() {
    var listener = new AuditLogShippingListener(shippingQueue, new SyncTaskExecutor());
    doThrow(new IllegalStateException("queue broken")).when(shippingQueue).enqueue(any());

    assertThatCode(
            () ->
                listener.onAuditLogCreated(
                    new AuditLogCreatedEvent(auditLog("LOGIN", null, CREATED_AT))))
        .doesNotThrowAnyException();
  }

  @Test
  void onAuditLogCreated_executorRejects_isSwallowed() {
    var listener =
        new AuditLogShippingListener(
            shippingQueue,
            task -> {
              throw new TaskRejectedException("pipeline scheduler shut down");
            });

    assertThatCode(
            () ->
                listener.onAuditLogCreated(
                    new AuditLogCreatedEvent(auditLog("LOGIN", null, CREATED_AT))))
        .doesNotThrowAnyException();
    verifyNoInteractions(shippingQueue);
  }
}
