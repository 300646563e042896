package jobqueue.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link jobqueue.jdbc.store.AbstractJdbcJobStore} and its subclasses.
 */
public final class JobStoreException extends RuntimeException {
  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
