package jobqueue.resilience;

/**
 * Failure reported by an external service, carrying the HTTP status when there was one.
 *
 * <p>A status of {@link #NO_STATUS} means the request never produced a response
 * (connection refused, reset, DNS failure).
 */
public class ExternalServiceException extends RuntimeException {
  public static final int NO_STATUS = -1;

  private final int statusCode;

  public ExternalServiceException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public ExternalServiceException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }

  /**
   * Rate limits, server errors and network failures are transient; other client errors
   * are not.
   *
   * @return {@code true} if retrying the same request may succeed
   */
  public boolean isRetryable() {
    return statusCode == NO_STATUS || statusCode == 429 || statusCode >= 500;
  }
}
