package io.shogun.api.audit;

import java.time.Instant;
import java.util.Map;

/** Aggregated audit counts for a time window {@code [start, end)}. */
public record AuditStatistics(
    long total,
    Map<String, Long> byAction,
    Map<String, Long> byEntityType,
    Map<String, Long> byUser,
    Period period) {

  public record Period(Instant start, Instant end) {}
}
