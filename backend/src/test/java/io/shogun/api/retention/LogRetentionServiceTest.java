package io.shogun.api.retention;

import static io.shogun.api.audit.AuditLogFixtures.auditLog;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.shogun.api.audit.AuditLog;
import io.shogun.api.audit.AuditLogRepository;
import io.shogun.api.shipping.LogShippingQueue;
import io.shogun.api.shipping.LogSinkException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Limit;

@ExtendWith(MockitoExtension.class)
class LogRetentionServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T02:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Mock private AuditLogRepository auditLogRepository;
  @Mock private LogShippingQueue shippingQueue;

  private static LogRetentionProperties properties(
      boolean enabled, int batchSize, boolean archive, Duration batchDelay) {
    return new LogRetentionProperties(
        enabled, 90, 180, 30, 60, batchSize, batchDelay, archive, "0 0 2 * * *", Duration.ofMinutes(5));
  }

  private LogRetentionService service(LogRetentionProperties properties) {
    return new LogRetentionService(auditLogRepository, shippingQueue, properties, CLOCK);
  }

  private static List<AuditLog> logs(String action, int count) {
    var logs = new ArrayList<AuditLog>(count);
    IntStream.range(0, count)
        .forEach(i -> logs.add(auditLog(action, null, NOW.minus(Duration.ofDays(400)))));
    return logs;
  }

  private static List<UUID> ids(List<AuditLog> logs) {
    return logs.stream().map(AuditLog::getId).toList();
  }

  @Test
  void runCleanup_disabled_returnsZerosWithoutTouchingStore() {
    var service = service(properties(false, 1000, true, Duration.ZERO));

    var result = service.runCleanup();

    assertThat(result).isEqualTo(new RetentionCleanupResult(0, 0, 0, 0, 0));
    verifyNoInteractions(auditLogRepository, shippingQueue);
  }

  @Test
  void runCleanup_appliesPerCategoryCutoffsInOrder() {
    var service = service(properties(true, 1000, false, Duration.ZERO));
    var authLogs = logs("LOGIN", 2);
    var otherLogs = logs("EXPORT", 3);
    when(auditLogRepository.findByCreatedAtBeforeAndActionIn(
            eq(NOW.minus(Duration.ofDays(90))), eq(LogCategory.AUTH_ACTIONS), any(Limit.class)))
        .thenReturn(authLogs, List.of());
    when(auditLogRepository.findByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
            eq(NOW.minus(Duration.ofDays(60))),
            eq(LogCategory.AUTH_AND_CRUD_ACTIONS),
            any(Limit.class)))
        .thenReturn(otherLogs, List.of());

    var result = service.runCleanup();

    assertThat(result).isEqualTo(new RetentionCleanupResult(2, 0, 0, 3, 5));
    var order = inOrder(auditLogRepository);
    order
        .verify(auditLogRepository, times(2))
        .findByCreatedAtBeforeAndActionIn(any(), any(), any(Limit.class));
    order
        .verify(auditLogRepository)
        .findByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
            eq(NOW.minus(Duration.ofDays(180))), eq(LogCategory.AUTH_ACTIONS), any(Limit.class));
    order
        .verify(auditLogRepository)
        .findByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
            eq(NOW.minus(Duration.ofDays(30))), eq(LogCategory.CRUD_ACTIONS), any(Limit.class));
    order
        .verify(auditLogRepository, times(2))
        .findByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
            any(), any(), any(Limit.class));
    verify(auditLogRepository).deleteAllByIdInBatch(ids(authLogs));
    verify(auditLogRepository).deleteAllByIdInBatch(ids(otherLogs));
  }

  @Test
  void cleanupCrudLogs_oneFullBatchWithFailingSink_deletesOnceAndStopsOnEmptySelect() {
    var service = service(properties(true, 1000, true, Duration.ZERO));
    var crudLogs = logs("UPDATE", 1000);
    when(auditLogRepository.findByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
            any(), eq(LogCategory.CRUD_ACTIONS), any(Limit.class)))
        .thenReturn(crudLogs, List.of());
    doThrow(new LogSinkException("Axiom API error: 500 - boom", 500))
        .when(shippingQueue)
        .archive(anyList());

    long deleted = service.cleanupCrudLogs();

    assertThat(deleted).isEqualTo(1000);
    verify(shippingQueue).archive(crudLogs);
    verify(auditLogRepository, times(1)).deleteAllByIdInBatch(anyList());
    verify(auditLogRepository, times(2))
        .findByCreatedAtBeforeAndActionInAndErrorMessageIsNull(any(), any(), any(Limit.class));
  }

  @Test
  void deleteLogsBatch_runsCeilOfCountOverBatchSizeRounds() {
    var service = service(properties(true, 2, false, Duration.ZERO));
    var all = logs("EXPORT", 5);
    var cutoff = NOW.minus(Duration.ofDays(60));
    when(auditLogRepository.findByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
            eq(cutoff), eq(LogCategory.AUTH_AND_CRUD_ACTIONS), any(Limit.class)))
        .thenReturn(all.subList(0, 2), all.subList(2, 4), all.subList(4, 5), List.of());

    long deleted = service.deleteLogsBatch(LogCategory.OTHER, cutoff);

    assertThat(deleted).isEqualTo(5);
    verify(auditLogRepository, times(3)).deleteAllByIdInBatch(anyList());
    verify(auditLogRepository, times(4))
        .findByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(any(), any(), any(Limit.class));
    verify(shippingQueue, never()).archive(anyList());
  }

  @Test
  void deleteLogsBatch_archiveFailure_stillDeletesBatch() {
    var service = service(properties(true, 1000, true, Duration.ZERO));
    var errorLogs = logs("CREATE_FAILED", 3);
    var cutoff = NOW.minus(Duration.ofDays(180));
    when(auditLogRepository.findByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
            eq(cutoff), eq(LogCategory.AUTH_ACTIONS), any(Limit.class)))
        .thenReturn(errorLogs, List.of());
    doThrow(new LogSinkException("Axiom API error: 503 - unavailable", 503))
        .when(shippingQueue)
        .archive(errorLogs);

    long deleted = service.deleteLogsBatch(LogCategory.ERROR, cutoff);

    assertThat(deleted).isEqualTo(3);
    verify(auditLogRepository).deleteAllByIdInBatch(ids(errorLogs));
  }

  @Test
  void runCleanup_storeFailure_propagatesAndAbortsRemainingCategories() {
    var service = service(properties(true, 1000, true, Duration.ZERO));
    when(auditLogRepository.findByCreatedAtBeforeAndActionIn(any(), any(), any(Limit.class)))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(service::runCleanup)
        .isInstanceOf(DataAccessResourceFailureException.class);
    verify(auditLogRepository, never())
        .findByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
            any(), any(), any(Limit.class));
    verify(auditLogRepository, never()).deleteAllByIdInBatch(anyList());
  }

  @Test
  void deleteLogsBatch_interruptedDuringDelay_stopsAfterCurrentBatch() {
    var service = service(properties(true, 2, false, Duration.ofMillis(50)));
    var authLogs = logs("LOGOUT", 2);
    when(auditLogRepository.findByCreatedAtBeforeAndActionIn(any(), any(), any(Limit.class)))
        .thenReturn(authLogs);

    Thread.currentThread().interrupt();
    long deleted;
    try {
      deleted = service.deleteLogsBatch(LogCategory.AUTH, NOW);
    } finally {
      assertThat(Thread.interrupted()).isTrue();
    }

    assertThat(deleted).isEqualTo(2);
    verify(auditLogRepository, times(1)).deleteAllByIdInBatch(anyList());
  }

  @Test
  void runCleanup_interruptedDuringAuthCleanup_skipsRemainingCategories() {
    var service = service(properties(true, 2, false, Duration.ofMillis(50)));
    var authLogs = logs("LOGOUT", 2);
    when(auditLogRepository.findByCreatedAtBeforeAndActionIn(any(), any(), any(Limit.class)))
        .thenAnswer(
            invocation -> {
              Thread.currentThread().interrupt();
              return authLogs;
            });

    RetentionCleanupResult result;
    try {
      result = service.runCleanup();
    } finally {
      assertThat(Thread.interrupted()).isTrue();
    }

    assertThat(result).isEqualTo(RetentionCleanupResult.of(2, 0, 0, 0));
    verify(auditLogRepository, times(1))
        .findByCreatedAtBeforeAndActionIn(any(), any(), any(Limit.class));
    verify(auditLogRepository, never())
        .findByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
            any(), any(), any(Limit.class));
    verify(auditLogRepository, times(1)).deleteAllByIdInBatch(anyList());
  }

  @Test
  void getRetentionStats_reportsPoliciesCutoffsAndCounts() {
    var service = service(properties(true, 1000, true, Duration.ZERO));
    when(auditLogRepository.countByCreatedAtBeforeAndActionIn(
            NOW.minus(Duration.ofDays(90)), LogCategory.AUTH_ACTIONS))
        .thenReturn(4L);
    when(auditLogRepository.countByCreatedAtBeforeAndErrorMessageIsNotNullAndActionNotIn(
            NOW.minus(Duration.ofDays(180)), LogCategory.AUTH_ACTIONS))
        .thenReturn(1L);
    when(auditLogRepository.countByCreatedAtBeforeAndActionInAndErrorMessageIsNull(
            NOW.minus(Duration.ofDays(30)), LogCategory.CRUD_ACTIONS))
        .thenReturn(12L);
    when(auditLogRepository.countByCreatedAtBeforeAndActionNotInAndErrorMessageIsNull(
            NOW.minus(Duration.ofDays(60)), LogCategory.AUTH_AND_CRUD_ACTIONS))
        .thenReturn(0L);
    when(auditLogRepository.count()).thenReturn(250L);

    var stats = service.getRetentionStats();

    assertThat(stats.enabled()).isTrue();
    assertThat(stats.archiveToAxiom()).isTrue();
    assertThat(stats.totalLogs()).isEqualTo(250);
    assertThat(stats.retentionPolicies().keySet())
        .containsExactly("auth", "error", "crud", "other");
    assertThat(stats.retentionPolicies().get("crud"))
        .isEqualTo(
            new RetentionStats.CategoryStats(30, Instant.parse("2026-01-30T02:00:00Z"), 12));
    assertThat(stats.retentionPolicies().get("auth").logsToDelete()).isEqualTo(4);
    assertThat(stats.retentionPolicies().get("error").days()).isEqualTo(180);
  }
}
