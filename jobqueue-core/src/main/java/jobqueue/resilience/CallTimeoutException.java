package jobqueue.resilience;

import java.time.Duration;

/**
 * Thrown when a single attempt of a protected call exceeds its timeout.
 */
public final class CallTimeoutException extends ResilienceException {
  private final Duration timeout;

  public CallTimeoutException(String callName, Duration timeout) {
    super("Call '" + callName + "' timed out after " + timeout.toMillis() + "ms");
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
