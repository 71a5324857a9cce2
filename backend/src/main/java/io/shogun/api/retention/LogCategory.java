package io.shogun.api.retention;

import io.shogun.api.audit.AuditLog;
import java.util.HashSet;
import java.util.Set;

/**
 * Retention category of an audit log. Every log belongs to exactly one category, decided in the
 * order auth, error, crud, other.
 */
public enum LogCategory {
  AUTH("auth"),
  ERROR("error"),
  CRUD("crud"),
  OTHER("other");

  public static final Set<String> AUTH_ACTIONS =
      Set.of(
          "LOGIN",
          "LOGOUT",
          "REGISTER",
          "LOGIN_FAILED",
          "REGISTER_FAILED",
          "PASSWORD_RESET",
          "PASSWORD_CHANGE");

  public static final Set<String> CRUD_ACTIONS = Set.of("CREATE", "UPDATE", "DELETE");

  /** Actions excluded from {@link #OTHER}. */
  public static final Set<String> AUTH_AND_CRUD_ACTIONS = union(AUTH_ACTIONS, CRUD_ACTIONS);

  private final String key;

  LogCategory(String key) {
    this.key = key;
  }

  /** Lower-case name used in configuration keys and JSON responses. */
  public String key() {
    return key;
  }

  public boolean matches(AuditLog log) {
    return classify(log) == this;
  }

  public static LogCategory classify(AuditLog log) {
    return classify(log.getAction(), log.getErrorMessage());
  }

  public static LogCategory classify(String action, String errorMessage) {
    if (AUTH_ACTIONS.contains(action)) {
      return AUTH;
    }
    if (errorMessage != null) {
      return ERROR;
    }
    if (CRUD_ACTIONS.contains(action)) {
      return CRUD;
    }
    return OTHER;
  }

  private static Set<String> union(Set<String> first, Set<String> second) {
    var union = new HashSet<String>(first);
    union.addAll(second);
    return Set.copyOf(union);
  }
}
