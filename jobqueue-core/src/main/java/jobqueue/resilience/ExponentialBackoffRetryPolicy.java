package jobqueue.resilience;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy using exponential backoff with symmetric jitter.
 *
 * <p>Delay formula for a 0-indexed attempt:
 * {@code delay = min(initialDelay * multiplier^attempt, maxDelay)}, then a uniform jitter in
 * {@code [-jitterFactor * delay, +jitterFactor * delay)} is added and the result is floored to
 * a non-negative whole number of milliseconds. With the default jitter factor of 0.2 the
 * final delay never exceeds {@code 1.2 * maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final double DEFAULT_JITTER_FACTOR = 0.2;

  private final long initialDelayMs;
  private final double multiplier;
  private final long maxDelayMs;
  private final double jitterFactor;
  private final DoubleSupplier random;

  /**
   * @param initialDelayMs delay for the first retry before jitter (milliseconds)
   * @param multiplier     growth factor per attempt
   * @param maxDelayMs     cap applied before jitter (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long initialDelayMs, double multiplier, long maxDelayMs) {
    this(initialDelayMs, multiplier, maxDelayMs, DEFAULT_JITTER_FACTOR,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  ExponentialBackoffRetryPolicy(long initialDelayMs, double multiplier, long maxDelayMs,
      double jitterFactor, DoubleSupplier random) {
    if (initialDelayMs < 0) {
      throw new IllegalArgumentException("initialDelayMs must be >= 0, got: " + initialDelayMs);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
      throw new IllegalArgumentException("jitterFactor must be in [0, 1), got: " + jitterFactor);
    }
    this.initialDelayMs = initialDelayMs;
    this.multiplier = multiplier;
    this.maxDelayMs = maxDelayMs;
    this.jitterFactor = jitterFactor;
    this.random = random;
  }

  /**
   * Returns the capped exponential delay for an attempt, before jitter.
   *
   * @param attempt the failed attempt, 0-indexed
   * @return {@code min(initialDelay * multiplier^attempt, maxDelay)}, or 0 for negative attempts
   */
  public long baseDelayMs(int attempt) {
    if (attempt < 0) {
      return 0L;
    }
    // Math.pow overflows to Infinity, which the cap absorbs
    double exponential = initialDelayMs * Math.pow(multiplier, attempt);
    return (long) Math.min(exponential, (double) maxDelayMs);
  }

  @Override
  public long computeDelayMs(int attempt) {
    long delay = baseDelayMs(attempt);
    double jitter = delay * jitterFactor * (random.getAsDouble() * 2 - 1);
    return Math.max(0L, (long) Math.floor(delay + jitter));
  }

  public long initialDelayMs() {
    return initialDelayMs;
  }

  public double multiplier() {
    return multiplier;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
