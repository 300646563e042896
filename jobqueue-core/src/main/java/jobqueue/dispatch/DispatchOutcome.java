package jobqueue.dispatch;

/**
 * How a dispatched job ended.
 */
public enum DispatchOutcome {
  /** The handler returned and the job was marked COMPLETED. */
  COMPLETED,
  /** The handler (or an interceptor) threw and the job was marked FAILED. */
  FAILED,
  /** No handler is registered for the job's type; the job was marked FAILED. */
  UNKNOWN_TYPE
}
