package io.shogun.api.retention;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable retention configuration resolved once at startup: one policy per category plus the
 * settings shared by every category's deletion loop.
 */
public final class RetentionPolicyTable {

  private final Map<LogCategory, RetentionPolicy> policies;
  private final int batchSize;
  private final boolean archiveBeforeDelete;

  private RetentionPolicyTable(
      Map<LogCategory, RetentionPolicy> policies, int batchSize, boolean archiveBeforeDelete) {
    this.policies = Collections.unmodifiableMap(policies);
    this.batchSize = batchSize;
    this.archiveBeforeDelete = archiveBeforeDelete;
  }

  public static RetentionPolicyTable from(LogRetentionProperties properties) {
    var policies = new EnumMap<LogCategory, RetentionPolicy>(LogCategory.class);
    policies.put(LogCategory.AUTH, new RetentionPolicy(LogCategory.AUTH, properties.authDays()));
    policies.put(LogCategory.ERROR, new RetentionPolicy(LogCategory.ERROR, properties.errorDays()));
    policies.put(LogCategory.CRUD, new RetentionPolicy(LogCategory.CRUD, properties.crudDays()));
    policies.put(
        LogCategory.OTHER, new RetentionPolicy(LogCategory.OTHER, properties.defaultDays()));
    return new RetentionPolicyTable(
        policies, properties.batchSize(), properties.archiveToAxiom());
  }

  public RetentionPolicy policyFor(LogCategory category) {
    return policies.get(category);
  }

  /** Policies in category order. */
  public Collection<RetentionPolicy> policies() {
    return policies.values();
  }

  public int batchSize() {
    return batchSize;
  }

  public boolean archiveBeforeDelete() {
    return archiveBeforeDelete;
  }
}
