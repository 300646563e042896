package jobqueue.resilience;

/**
 * Strategy for computing the delay before retrying a failed outbound call.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds to wait after a failed attempt.
   *
   * @param attempt the failed attempt, 0-indexed (0 is the first call)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempt);
}
