package jobqueue.dispatch;

/**
 * Thrown when no handler is registered for a job's type.
 *
 * <p>The dispatcher treats this as a non-retryable failure and immediately marks the job
 * as FAILED.
 */
public final class UnknownJobTypeException extends Exception {
  private final String jobType;

  public UnknownJobTypeException(String jobType) {
    super("unknown job type: " + jobType);
    this.jobType = jobType;
  }

  public String jobType() {
    return jobType;
  }
}
