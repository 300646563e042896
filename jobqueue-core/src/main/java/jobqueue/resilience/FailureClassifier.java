package jobqueue.resilience;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed attempt is worth retrying.
 */
@FunctionalInterface
public interface FailureClassifier {

  /**
   * Retries rate limits, 5xx responses, network errors and timeouts. Everything else,
   * including 4xx client errors and validation failures, is surfaced immediately.
   */
  FailureClassifier DEFAULT = failure -> {
    if (failure instanceof ExternalServiceException ese) {
      return ese.isRetryable();
    }
    return failure instanceof CallTimeoutException
        || failure instanceof IOException
        || failure instanceof TimeoutException;
  };

  boolean isRetryable(Throwable failure);
}
