package jobqueue.resilience;

/**
 * Thrown when a call is rejected because the circuit for its dependency is OPEN.
 * The protected call is not invoked.
 */
public final class CircuitOpenException extends ResilienceException {
  private final String breakerName;

  public CircuitOpenException(String breakerName) {
    super("Circuit breaker '" + breakerName + "' is OPEN");
    this.breakerName = breakerName;
  }

  public String breakerName() {
    return breakerName;
  }
}
