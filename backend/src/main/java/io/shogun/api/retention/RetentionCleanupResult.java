package io.shogun.api.retention;

/** Number of logs deleted per category by one cleanup run. */
public record RetentionCleanupResult(long auth, long error, long crud, long other, long total) {

  public static RetentionCleanupResult of(long auth, long error, long crud, long other) {
    return new RetentionCleanupResult(auth, error, crud, other, auth + error + crud + other);
  }

  public static RetentionCleanupResult empty() {
    return new RetentionCleanupResult(0, 0, 0, 0, 0);
  }
}
