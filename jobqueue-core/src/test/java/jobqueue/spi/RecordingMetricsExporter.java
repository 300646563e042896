package jobqueue.spi;

import jobqueue.resilience.CircuitState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MetricsExporter that keeps every call for assertions.
 */
public class RecordingMetricsExporter implements MetricsExporter {
  public final AtomicInteger enqueued = new AtomicInteger();
  public final AtomicInteger claimed = new AtomicInteger();
  public final AtomicInteger completed = new AtomicInteger();
  public final AtomicInteger failed = new AtomicInteger();
  public final AtomicInteger unknownType = new AtomicInteger();
  public final AtomicInteger ticksSkipped = new AtomicInteger();
  public final List<String> timedTypes = new CopyOnWriteArrayList<>();
  public final List<CircuitState> circuitStates = new CopyOnWriteArrayList<>();

  @Override
  public void incrementEnqueued() {
    enqueued.incrementAndGet();
  }

  @Override
  public void incrementClaimed() {
    claimed.incrementAndGet();
  }

  @Override
  public void incrementCompleted() {
    completed.incrementAndGet();
  }

  @Override
  public void incrementFailed() {
    failed.incrementAndGet();
  }

  @Override
  public void incrementUnknownType() {
    unknownType.incrementAndGet();
  }

  @Override
  public void incrementTickSkipped() {
    ticksSkipped.incrementAndGet();
  }

  @Override
  public void recordHandlerDurationMs(String jobType, long durationMs) {
    if (durationMs < 0) {
      throw new AssertionError("negative duration for " + jobType);
    }
    timedTypes.add(jobType);
  }

  @Override
  public void recordCircuitState(String breakerName, CircuitState state) {
    circuitStates.add(state);
  }
}
