package io.shogun.api.audit;

import java.util.Map;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditLogRecord)}. Usually constructed by {@link
 * AuditLogBuilder}, which fills in request metadata.
 *
 * @param userId id of the acting user; null for system-initiated entries
 * @param username display name of the acting user
 * @param action action label, e.g. {@code LOGIN}, {@code CREATE}, {@code UPDATE_FAILED}
 * @param entityType kind of entity affected (e.g. "Shot", "Playlist")
 * @param entityId id or code of the affected entity (not a FK)
 * @param changes request payload or field changes; nullable
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header
 * @param method HTTP method
 * @param endpoint request URI
 * @param statusCode response status code
 * @param errorMessage failure message; a non-null value files the entry under the error category
 * @param metadata free-form extra data (durations, sizes)
 */
public record AuditLogRecord(
    Long userId,
    String username,
    String action,
    String entityType,
    String entityId,
    Map<String, Object> changes,
    String ipAddress,
    String userAgent,
    String method,
    String endpoint,
    Integer statusCode,
    String errorMessage,
    Map<String, Object> metadata) {}
