package io.shogun.api.shipping;

import io.shogun.api.audit.AuditLog;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * In-memory buffer between audit log producers and the {@link LogSink}.
 *
 * <p>Records are shipped in batches of {@code batchSize}, either as soon as the buffer reaches a
 * full batch or on the periodic flush timer. A failed batch goes back to the front of the buffer
 * in its original order, after which the oldest records are dropped so the buffer never holds
 * more than {@code batchSize * 10} entries. Only one flush talks to the sink at a time; archive
 * calls from the retention engine bypass the buffer entirely.
 *
 * <p>When shipping is disabled or incompletely configured every operation is a no-op.
 */
@Component
public class LogShippingQueue implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(LogShippingQueue.class);

  /**
   * Below the web server's graceful shutdown and stop phases, so requests still completing during
   * shutdown have enqueued their audit logs before the final flush.
   */
  static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

  private final LogSink sink;
  private final AxiomProperties properties;
  private final TaskScheduler scheduler;

  private final Deque<AuditLog> buffer = new ArrayDeque<>();
  private final ReentrantLock bufferLock = new ReentrantLock();
  private final ReentrantLock flushLock = new ReentrantLock();

  private volatile ScheduledFuture<?> flushTask;
  private volatile boolean running;

  public LogShippingQueue(LogSink sink, AxiomProperties properties, TaskScheduler scheduler) {
    this.sink = sink;
    this.properties = properties;
    this.scheduler = scheduler;
    if (!properties.enabled()) {
      log.info("Axiom log shipping is disabled");
    } else if (!properties.isConfigured()) {
      log.warn("Axiom log shipping is enabled but missing token, org id or dataset; not shipping");
    } else {
      log.info(
          "Axiom log shipping configured for dataset {} (batch size {}, flush interval {})",
          properties.dataset(),
          properties.batchSize(),
          properties.flushInterval());
    }
  }

  /** Buffers one record, flushing right away if that completes a batch. */
  public void enqueue(AuditLog auditLog) {
    enqueueAll(List.of(auditLog));
  }

  /** Buffers records in order, flushing right away if that completes a batch. */
  public void enqueueAll(Collection<AuditLog> logs) {
    if (!properties.isConfigured() || logs.isEmpty()) {
      return;
    }
    int size;
    int dropped;
    bufferLock.lock();
    try {
      buffer.addAll(logs);
      dropped = trimOldest();
      size = buffer.size();
    } finally {
      bufferLock.unlock();
    }
    if (dropped > 0) {
      log.warn("Dropped {} old audit logs due to queue overflow", dropped);
    }
    if (size >= properties.batchSize()) {
      flushIfIdle();
    }
  }

  /**
   * Sends up to one batch from the front of the buffer. Waits for an in-flight flush to finish
   * first. Never throws: a failed batch is put back at the front and the buffer is trimmed.
   */
  public void flush() {
    if (!properties.isConfigured()) {
      return;
    }
    flushLock.lock();
    try {
      shipFrontBatch();
    } finally {
      flushLock.unlock();
    }
  }

  /**
   * Sends records straight to the sink in {@code batchSize} chunks without touching the buffer.
   * Does nothing when shipping is not configured.
   *
   * @throws LogSinkException if any chunk fails; earlier chunks stay delivered
   */
  public void archive(List<AuditLog> logs) {
    if (!properties.isConfigured() || logs.isEmpty()) {
      return;
    }
    int batchSize = properties.batchSize();
    for (int from = 0; from < logs.size(); from += batchSize) {
      sink.send(logs.subList(from, Math.min(from + batchSize, logs.size())));
    }
    log.debug("Archived {} audit logs", logs.size());
  }

  public int getQueueSize() {
    bufferLock.lock();
    try {
      return buffer.size();
    } finally {
      bufferLock.unlock();
    }
  }

  public ShippingStatus getStatus() {
    return new ShippingStatus(properties.enabled(), properties.isConfigured(), getQueueSize());
  }

  @Override
  public void start() {
    if (properties.isConfigured()) {
      var interval = properties.flushInterval();
      flushTask =
          scheduler.scheduleAtFixedRate(this::flushOnTimer, Instant.now().plus(interval), interval);
    }
    running = true;
  }

  @Override
  public void stop() {
    var task = flushTask;
    if (task != null) {
      task.cancel(false);
      flushTask = null;
    }
    int pending = getQueueSize();
    if (pending > 0) {
      log.info("Flushing {} buffered audit logs before shutdown", pending);
      flush();
    }
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }

  void flushOnTimer() {
    try {
      if (getQueueSize() > 0) {
        flushIfIdle();
      }
    } catch (RuntimeException e) {
      log.error("Scheduled audit log flush failed: {}", e.getMessage(), e);
    }
  }

  private void flushIfIdle() {
    if (!flushLock.tryLock()) {
      log.debug("Flush already in progress; buffered logs wait for the next flush");
      return;
    }
    try {
      shipFrontBatch();
    } finally {
      flushLock.unlock();
    }
  }

  private void shipFrontBatch() {
    List<AuditLog> batch = pollFrontBatch();
    if (batch.isEmpty()) {
      return;
    }
    try {
      sink.send(batch);
      log.debug("Shipped {} audit logs to Axiom", batch.size());
    } catch (RuntimeException e) {
      log.error("Failed to ship {} audit logs to Axiom: {}", batch.size(), e.getMessage(), e);
      int dropped = pushFrontBatch(batch);
      if (dropped > 0) {
        log.warn("Dropped {} old audit logs due to queue overflow", dropped);
      }
    }
  }

  private List<AuditLog> pollFrontBatch() {
    bufferLock.lock();
    try {
      int count = Math.min(properties.batchSize(), buffer.size());
      var batch = new ArrayList<AuditLog>(count);
      for (int i = 0; i < count; i++) {
        batch.add(buffer.pollFirst());
      }
      return batch;
    } finally {
      bufferLock.unlock();
    }
  }

  private int pushFrontBatch(List<AuditLog> batch) {
    bufferLock.lock();
    try {
      ListIterator<AuditLog> it = batch.listIterator(batch.size());
      while (it.hasPrevious()) {
        buffer.addFirst(it.previous());
      }
      return trimOldest();
    } finally {
      bufferLock.unlock();
    }
  }

  // caller holds bufferLock
  private int trimOldest() {
    int dropped = 0;
    while (buffer.size() > properties.maxQueueSize()) {
      buffer.pollFirst();
      dropped++;
    }
    return dropped;
  }
}
