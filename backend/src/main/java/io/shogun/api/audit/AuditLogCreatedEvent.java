package io.shogun.api.audit;

/** Published after an {@link AuditLog} is saved; consumed by the log shipper. */
public record AuditLogCreatedEvent(AuditLog auditLog) {}
