package io.shogun.api.retention;

/** How long logs of one category are kept before the cleanup removes them. */
public record RetentionPolicy(LogCategory category, int retentionDays) {}
