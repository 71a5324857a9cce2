package io.shogun.api.shipping;

import io.shogun.api.audit.AuditLog;
import java.util.List;

/** Destination for shipped audit logs. One call delivers one batch. */
public interface LogSink {

  /**
   * Delivers the batch in a single request.
   *
   * @throws LogSinkException if the sink rejected the batch or could not be reached
   */
  void send(List<AuditLog> logs);
}
