package jobqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jobqueue.resilience.CircuitState;
import jobqueue.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.enqueued} - jobs inserted as PENDING</li>
 *   <li>{@code jobqueue.jobs.claimed} - jobs claimed by a worker</li>
 *   <li>{@code jobqueue.jobs.completed} - jobs whose handler returned a result</li>
 *   <li>{@code jobqueue.jobs.failed} - jobs whose handler threw</li>
 *   <li>{@code jobqueue.jobs.unknown_type} - jobs failed for lack of a handler</li>
 *   <li>{@code jobqueue.worker.ticks.skipped} - ticks skipped while the previous one ran</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code jobqueue.handler.duration} - handler execution time, tagged {@code type}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code jobqueue.circuit.state} - 0 closed, 1 open, 2 half-open; tagged {@code breaker}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter completed;
  private final Counter failed;
  private final Counter unknownType;
  private final Counter ticksSkipped;
  private final Map<String, Timer> handlerTimers = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> circuitStates = new ConcurrentHashMap<>();
  private final Map<String, Gauge> circuitGauges = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "jobqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "cms.jobs"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.enqueued = Counter.builder(namePrefix + ".jobs.enqueued")
        .description("Jobs inserted as PENDING")
        .register(registry);
    this.claimed = Counter.builder(namePrefix + ".jobs.claimed")
        .description("Jobs claimed by a worker")
        .register(registry);
    this.completed = Counter.builder(namePrefix + ".jobs.completed")
        .description("Jobs completed successfully")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".jobs.failed")
        .description("Jobs failed in their handler")
        .register(registry);
    this.unknownType = Counter.builder(namePrefix + ".jobs.unknown_type")
        .description("Jobs failed because no handler is registered")
        .register(registry);
    this.ticksSkipped = Counter.builder(namePrefix + ".worker.ticks.skipped")
        .description("Worker ticks skipped while the previous tick was running")
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementUnknownType() {
    if (closed) return;
    unknownType.increment();
  }

  @Override
  public void incrementTickSkipped() {
    if (closed) return;
    ticksSkipped.increment();
  }

  @Override
  public void recordHandlerDurationMs(String jobType, long durationMs) {
    if (closed) return;
    Timer timer = handlerTimers.computeIfAbsent(jobType, type ->
        Timer.builder(namePrefix + ".handler.duration")
            .description("Handler execution time")
            .tag("type", type)
            .register(registry));
    timer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordCircuitState(String breakerName, CircuitState state) {
    if (closed) return;
    AtomicInteger value = circuitStates.computeIfAbsent(breakerName, name -> {
      AtomicInteger holder = new AtomicInteger();
      circuitGauges.put(name, Gauge.builder(namePrefix + ".circuit.state", holder, AtomicInteger::get)
          .description("Circuit breaker state (0 closed, 1 open, 2 half-open)")
          .tag("breaker", name)
          .register(registry));
      return holder;
    });
    value.set(state.ordinal());
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(enqueued, claimed, completed, failed,
        unknownType, ticksSkipped));
    meters.addAll(handlerTimers.values());
    meters.addAll(circuitGauges.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
