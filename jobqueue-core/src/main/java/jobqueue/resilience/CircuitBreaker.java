package jobqueue.resilience;

import jobqueue.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three-state failure gate for one protected dependency.
 *
 * <ul>
 *   <li><b>CLOSED</b> (initial): every failure increments the failure count and refreshes the
 *       last failure time; reaching {@code failureThreshold} opens the circuit. Every success
 *       resets the failure count.</li>
 *   <li><b>OPEN</b>: {@link #tryAcquire()} returns {@code false} until {@code resetTimeout} has
 *       elapsed since the last failure; the first call after that moves to HALF_OPEN and is
 *       let through as a trial.</li>
 *   <li><b>HALF_OPEN</b>: trials pass through. {@code successThreshold} successes close the
 *       circuit; a single failure re-opens it.</li>
 * </ul>
 *
 * <p>Thresholds and timeout are fixed for the breaker's lifetime. State lives in process
 * memory only. This class is thread-safe.
 *
 * @see CircuitBreakerRegistry
 * @see ResilientCaller
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final String name;
  private final int failureThreshold;
  private final int successThreshold;
  private final Duration resetTimeout;
  private final Clock clock;
  private final MetricsExporter metrics;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private int successCount;
  private Instant lastFailureTime;

  private CircuitBreaker(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    if (builder.successThreshold < 1) {
      throw new IllegalArgumentException("successThreshold must be >= 1");
    }
    Objects.requireNonNull(builder.resetTimeout, "resetTimeout");
    if (builder.resetTimeout.isNegative()) {
      throw new IllegalArgumentException("resetTimeout must be >= 0");
    }
    this.failureThreshold = builder.failureThreshold;
    this.successThreshold = builder.successThreshold;
    this.resetTimeout = builder.resetTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Asks whether a call may proceed. In OPEN state this is also where the transition to
   * HALF_OPEN happens once the reset timeout has elapsed.
   *
   * @return {@code true} if the call may reach the dependency
   */
  public synchronized boolean tryAcquire() {
    if (state != CircuitState.OPEN) {
      return true;
    }
    Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
    if (sinceFailure.compareTo(resetTimeout) >= 0) {
      transitionTo(CircuitState.HALF_OPEN);
      return true;
    }
    return false;
  }

  /**
   * Records a successful call.
   */
  public synchronized void recordSuccess() {
    failureCount = 0;
    if (state == CircuitState.HALF_OPEN) {
      successCount++;
      if (successCount >= successThreshold) {
        transitionTo(CircuitState.CLOSED);
      }
    }
  }

  /**
   * Records a failed call, including timeouts.
   */
  public synchronized void recordFailure() {
    lastFailureTime = clock.instant();
    switch (state) {
      case HALF_OPEN -> transitionTo(CircuitState.OPEN);
      case CLOSED -> {
        failureCount++;
        if (failureCount >= failureThreshold) {
          transitionTo(CircuitState.OPEN);
        }
      }
      case OPEN -> {
        // a call admitted before the circuit opened; only the failure time moves
      }
    }
  }

  private void transitionTo(CircuitState next) {
    CircuitState previous = state;
    state = next;
    successCount = 0;
    if (next == CircuitState.CLOSED) {
      failureCount = 0;
    }
    Level level = next == CircuitState.OPEN ? Level.WARNING : Level.INFO;
    logger.log(level, "Circuit breaker '" + name + "' " + previous + " -> " + next
        + " (failures=" + failureCount + ")");
    metrics.recordCircuitState(name, next);
  }

  public String name() {
    return name;
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  public synchronized int successCount() {
    return successCount;
  }

  public synchronized Instant lastFailureTime() {
    return lastFailureTime;
  }

  public int failureThreshold() {
    return failureThreshold;
  }

  public int successThreshold() {
    return successThreshold;
  }

  public Duration resetTimeout() {
    return resetTimeout;
  }

  /**
   * Builder for {@link CircuitBreaker}.
   */
  public static final class Builder {
    private final String name;
    private int failureThreshold = 5;
    private int successThreshold = 2;
    private Duration resetTimeout = Duration.ofSeconds(60);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Consecutive failures in CLOSED state that open the circuit.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Successful trials in HALF_OPEN state that close the circuit.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &ge; 1.
     */
    public Builder successThreshold(int successThreshold) {
      this.successThreshold = successThreshold;
      return this;
    }

    /**
     * Time an OPEN circuit waits after the last failure before admitting a trial call.
     *
     * <p>Optional. Defaults to 60 seconds.
     */
    public Builder resetTimeout(Duration resetTimeout) {
      this.resetTimeout = resetTimeout;
      return this;
    }

    /**
     * Clock used to measure the reset timeout. Optional; defaults to the system UTC clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Exporter notified of state transitions. Optional; defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public CircuitBreaker build() {
      return new CircuitBreaker(this);
    }
  }
}
