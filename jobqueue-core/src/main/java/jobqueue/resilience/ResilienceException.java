package jobqueue.resilience;

/**
 * Base class for failures raised by the resilience layer itself rather than by the
 * protected call.
 */
public abstract class ResilienceException extends RuntimeException {

  protected ResilienceException(String message) {
    super(message);
  }

  protected ResilienceException(String message, Throwable cause) {
    super(message, cause);
  }
}
