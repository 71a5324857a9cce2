package io.shogun.api.audit;

import java.time.Instant;

/**
 * Query filter for {@link AuditService#findAll}. All fields are nullable -- null means "no filter
 * on this field".
 *
 * @param userId filter by acting user
 * @param entityType filter by entity kind (exact match)
 * @param action filter by action label (exact match)
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record AuditLogFilter(
    Long userId, String entityType, String action, Instant from, Instant to) {}
