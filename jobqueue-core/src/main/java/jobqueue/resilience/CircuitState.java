package jobqueue.resilience;

public enum CircuitState {
  /** Calls pass through; failures are counted. */
  CLOSED,
  /** Calls are rejected without reaching the dependency. */
  OPEN,
  /** Trial calls pass through to probe recovery. */
  HALF_OPEN
}
