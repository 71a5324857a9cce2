package io.shogun.api.retention;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit-logs/retention")
public class RetentionController {

  private final LogRetentionService retentionService;
  private final RetentionCleanupScheduler cleanupScheduler;

  public RetentionController(
      LogRetentionService retentionService, RetentionCleanupScheduler cleanupScheduler) {
    this.retentionService = retentionService;
    this.cleanupScheduler = cleanupScheduler;
  }

  @GetMapping("/stats")
  public ResponseEntity<RetentionStats> getStats() {
    return ResponseEntity.ok(retentionService.getRetentionStats());
  }

  @PostMapping("/cleanup")
  public ResponseEntity<RetentionCleanupResult> runCleanup() {
    return ResponseEntity.ok(cleanupScheduler.runNow());
  }
}
