/**
 * Protection for handlers that call unreliable external services.
 *
 * <p>{@link jobqueue.resilience.ResilientCaller} wraps one logical call with a per-attempt
 * timeout, exponential backoff with jitter between retryable failures, and gating by a
 * {@link jobqueue.resilience.CircuitBreaker}. Every attempt inside a retry sequence consults
 * and updates the same breaker.
 *
 * <p>Breaker state is process-local: sibling worker instances each keep their own breaker
 * for the same dependency and do not share its state.
 *
 * @see jobqueue.resilience.ResilientCaller
 * @see jobqueue.resilience.CircuitBreaker
 * @see jobqueue.resilience.ExponentialBackoffRetryPolicy
 */
package jobqueue.resilience;
