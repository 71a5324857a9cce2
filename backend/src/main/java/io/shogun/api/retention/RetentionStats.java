package io.shogun.api.retention;

import java.time.Instant;
import java.util.Map;

/**
 * Retention overview for operators.
 *
 * @param retentionPolicies keyed by {@link LogCategory#key()}, in category order
 * @param totalLogs all audit logs currently stored
 */
public record RetentionStats(
    boolean enabled,
    Map<String, CategoryStats> retentionPolicies,
    long totalLogs,
    boolean archiveToAxiom) {

  /** Policy of one category and the number of logs a cleanup run would remove now. */
  public record CategoryStats(int days, Instant cutoffDate, long logsToDelete) {}
}
