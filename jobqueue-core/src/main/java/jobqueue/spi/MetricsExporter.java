package jobqueue.spi;

import jobqueue.resilience.CircuitState;

/**
 * Observability hook for exporting job queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of jobs enqueued.
   */
  void incrementEnqueued();

  /**
   * Increments the count of jobs claimed by a worker.
   */
  void incrementClaimed();

  /**
   * Increments the count of jobs that completed successfully.
   */
  void incrementCompleted();

  /**
   * Increments the count of jobs that failed in their handler.
   */
  void incrementFailed();

  /**
   * Increments the count of jobs failed because no handler is registered for their type.
   */
  void incrementUnknownType();

  /**
   * Increments the count of worker ticks skipped because the previous tick was still running.
   */
  default void incrementTickSkipped() {
  }

  /**
   * Records the time spent executing a handler.
   *
   * @param jobType    the job type
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(String jobType, long durationMs) {
  }

  /**
   * Records a circuit breaker state change.
   *
   * @param breakerName the protected dependency
   * @param state       the new state
   */
  default void recordCircuitState(String breakerName, CircuitState state) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued() {
    }

    @Override
    public void incrementClaimed() {
    }

    @Override
    public void incrementCompleted() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementUnknownType() {
    }
  }
}
