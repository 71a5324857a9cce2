package io.shogun.api.shipping;

/** Raised when a batch could not be delivered to the log sink. */
public class LogSinkException extends RuntimeException {

  private final Integer statusCode;

  public LogSinkException(String message, Integer statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public LogSinkException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  /** HTTP status returned by the sink, or null when no response was received. */
  public Integer getStatusCode() {
    return statusCode;
  }
}
