package io.shogun.api.retention;

import io.shogun.api.exception.ResourceConflictException;
import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * Runs the log retention cleanup on the configured cron schedule (daily at 02:00 by default), in
 * the clock's time zone, plus one bootstrap run shortly after startup. Runs never overlap; a failed
 * run is logged and the schedule carries on.
 */
@Component
public class RetentionCleanupScheduler implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(RetentionCleanupScheduler.class);

  private final LogRetentionService retentionService;
  private final LogRetentionProperties properties;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final ReentrantLock runLock = new ReentrantLock();

  private volatile ScheduledFuture<?> dailyRun;
  private volatile ScheduledFuture<?> initialRun;
  private volatile boolean running;

  public RetentionCleanupScheduler(
      LogRetentionService retentionService,
      LogRetentionProperties properties,
      TaskScheduler scheduler,
      Clock clock) {
    this.retentionService = retentionService;
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  @Override
  public void start() {
    running = true;
    if (!retentionService.isEnabled()) {
      log.info("Log retention is disabled, cleanup will not be scheduled");
      return;
    }
    dailyRun = scheduler.schedule(this::runScheduled, dailyTrigger());
    initialRun =
        scheduler.schedule(this::runScheduled, clock.instant().plus(properties.initialDelay()));
    log.info(
        "Log retention cleanup scheduled with cron '{}' ({}), initial run in {}",
        properties.cron(),
        clock.getZone(),
        properties.initialDelay());
  }

  @Override
  public void stop() {
    cancel(dailyRun);
    cancel(initialRun);
    dailyRun = null;
    initialRun = null;
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /**
   * Runs a cleanup on the calling thread.
   *
   * @throws ResourceConflictException if a cleanup is already in progress
   */
  public RetentionCleanupResult runNow() {
    if (!runLock.tryLock()) {
      throw new ResourceConflictException(
          "Cleanup in progress", "A log retention cleanup is already running");
    }
    try {
      return retentionService.runCleanup();
    } finally {
      runLock.unlock();
    }
  }

  void runScheduled() {
    if (!runLock.tryLock()) {
      log.warn("Previous log retention cleanup is still running, skipping this run");
      return;
    }
    try {
      retentionService.runCleanup();
    } catch (RuntimeException e) {
      log.error("Scheduled log retention cleanup failed: {}", e.getMessage(), e);
    } finally {
      runLock.unlock();
    }
  }

  CronTrigger dailyTrigger() {
    return new CronTrigger(properties.cron(), clock.getZone());
  }

  private static void cancel(ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }
}
