package jobqueue;

/**
 * Unchecked exception raised when the job store cannot be reached from the client-facing API.
 */
public class JobQueueException extends RuntimeException {

  public JobQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
