package jobqueue.resilience;

import jobqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes a call against an unreliable dependency with a per-attempt timeout, retries with
 * exponential backoff, and circuit breaker gating.
 *
 * <p>For each attempt:
 * <ol>
 *   <li>The {@link CircuitBreaker} is consulted. A rejection throws
 *       {@link CircuitOpenException} without invoking the call.</li>
 *   <li>The call runs on a daemon thread and is abandoned (cancelled) after
 *       {@code callTimeout}, producing a {@link CallTimeoutException}.</li>
 *   <li>The outcome is recorded on the breaker. Timeouts count as failures.</li>
 *   <li>Failures the {@link FailureClassifier} considers retryable are retried up to
 *       {@code maxRetries} times, sleeping {@link RetryPolicy#computeDelayMs} between
 *       attempts. Other failures are rethrown at once.</li>
 * </ol>
 *
 * <p>After the last retry the final failure is rethrown unchanged. An interrupt during the
 * backoff sleep restores the thread's interrupt flag and ends the retry loop with the last
 * failure.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ResilientCaller caller = ResilientCaller.builder()
 *     .name("openai")
 *     .circuitBreaker(breakers.breaker("openai"))
 *     .callTimeout(Duration.ofSeconds(30))
 *     .build();
 *
 * String body = caller.call(() -> http.send(request));
 * }</pre>
 *
 * <p>This class is thread-safe; concurrent calls share the breaker.
 *
 * @see ResilientCaller.Builder
 */
public final class ResilientCaller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ResilientCaller.class.getName());

  private final String name;
  private final CircuitBreaker circuitBreaker;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final Duration callTimeout;
  private final FailureClassifier failureClassifier;
  private final Sleeper sleeper;
  private final ExecutorService executor;

  private ResilientCaller(Builder builder) {
    this.circuitBreaker = Objects.requireNonNull(builder.circuitBreaker, "circuitBreaker");
    this.name = builder.name != null ? builder.name : circuitBreaker.name();
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(builder.callTimeout, "callTimeout");
    if (builder.callTimeout.isNegative() || builder.callTimeout.isZero()) {
      throw new IllegalArgumentException("callTimeout must be positive");
    }
    this.maxRetries = builder.maxRetries;
    this.callTimeout = builder.callTimeout;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 2.0, 10_000);
    this.failureClassifier = builder.failureClassifier != null
        ? builder.failureClassifier : FailureClassifier.DEFAULT;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("resilient-" + name + "-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Invokes the call under timeout, retry and circuit breaker protection.
   *
   * @param call the protected call
   * @param <T>  result type
   * @return the result of the first successful attempt
   * @throws CircuitOpenException if the breaker rejects an attempt
   * @throws Exception            the last failure of the call once retries are exhausted, or
   *                              the first non-retryable failure
   */
  public <T> T call(Callable<T> call) throws Exception {
    Objects.requireNonNull(call, "call");
    int attempt = 0;
    while (true) {
      if (!circuitBreaker.tryAcquire()) {
        throw new CircuitOpenException(circuitBreaker.name());
      }

      Throwable failure;
      try {
        T result = invokeWithTimeout(call);
        circuitBreaker.recordSuccess();
        return result;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw e;
      } catch (Exception | Error e) {
        circuitBreaker.recordFailure();
        failure = e;
      }

      if (attempt >= maxRetries || !failureClassifier.isRetryable(failure)) {
        throw rethrow(failure);
      }

      long delayMs = retryPolicy.computeDelayMs(attempt);
      logger.log(Level.WARNING, "Call '" + name + "' attempt " + (attempt + 1) + " of "
          + (maxRetries + 1) + " failed, retrying in " + delayMs + "ms: " + failure);
      try {
        sleeper.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw rethrow(failure);
      }
      attempt++;
    }
  }

  private <T> T invokeWithTimeout(Callable<T> call) throws Exception {
    Future<T> future = executor.submit(call);
    try {
      return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new CallTimeoutException(name, callTimeout);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw e;
    }
  }

  private static Exception rethrow(Throwable failure) {
    if (failure instanceof Error error) {
      throw error;
    }
    return (Exception) failure;
  }

  public String name() {
    return name;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  /**
   * Shuts down the call executor. Attempts still in flight are interrupted.
   */
  @Override
  public void close() {
    executor.shutdownNow();
  }

  /**
   * Builder for {@link ResilientCaller}.
   */
  public static final class Builder {
    private String name;
    private CircuitBreaker circuitBreaker;
    private RetryPolicy retryPolicy;
    private int maxRetries = 3;
    private Duration callTimeout = Duration.ofSeconds(30);
    private FailureClassifier failureClassifier;
    private Sleeper sleeper;

    private Builder() {
    }

    /**
     * Sets the name used in logs and thread names.
     *
     * <p>Optional. Defaults to the circuit breaker's name.
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the breaker guarding the dependency.
     *
     * <p><b>Required.</b>
     */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /**
     * Sets the policy computing the delay between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code initialDelayMs=1000}, {@code multiplier=2.0} and {@code maxDelayMs=10000}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of retries after the first attempt.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the timeout applied to each attempt.
     *
     * <p>Optional. Defaults to 30 seconds. Must be positive.
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    /**
     * Sets the classifier deciding which failures are retried.
     *
     * <p>Optional. Defaults to {@link FailureClassifier#DEFAULT}.
     */
    public Builder failureClassifier(FailureClassifier failureClassifier) {
      this.failureClassifier = failureClassifier;
      return this;
    }

    /**
     * Sets how the caller waits between attempts.
     *
     * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public ResilientCaller build() {
      return new ResilientCaller(this);
    }
  }
}
