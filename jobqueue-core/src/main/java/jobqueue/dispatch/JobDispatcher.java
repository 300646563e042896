package jobqueue.dispatch;

import jobqueue.JobHandler;
import jobqueue.model.Job;
import jobqueue.registry.HandlerRegistry;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes the registered handler for a claimed job and records the terminal status.
 *
 * <p>Dispatch runs synchronously on the calling (worker) thread:
 * <ul>
 *   <li>No handler for the job's type: the job is marked FAILED with
 *       {@code "unknown job type: <type>"} and no handler runs.</li>
 *   <li>The handler returns: the result is encoded as JSON ({@code null} becomes
 *       {@code {}}) and the job is marked COMPLETED.</li>
 *   <li>The handler throws: the job is marked FAILED with the exception message, or the
 *       exception class name when there is no message.</li>
 * </ul>
 *
 * <p>The dispatcher never retries and never lets a handler failure escape. A handler
 * {@link Error} also fails the job; {@link VirtualMachineError}s other than
 * {@link StackOverflowError} are rethrown after the job is marked. Status updates
 * run in auto-commit mode on a fresh connection; a failed status update is logged and the
 * job stays PROCESSING.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see JobDispatcher.Builder
 * @see JobInterceptor
 */
public final class JobDispatcher {
  private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final HandlerRegistry handlerRegistry;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;
  private final List<JobInterceptor> interceptors;

  private JobDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches a job that the caller has already claimed (status PROCESSING).
   *
   * @param job the claimed job
   * @return how the job ended
   */
  public DispatchOutcome dispatch(Job job) {
    Objects.requireNonNull(job, "job");
    long start = System.nanoTime();
    try {
      Object result = deliver(job);
      markCompleted(job.id(), jsonCodec.toJson(result));
      metrics.incrementCompleted();
      return DispatchOutcome.COMPLETED;
    } catch (UnknownJobTypeException e) {
      markFailed(job.id(), e.getMessage());
      metrics.incrementUnknownType();
      logger.log(Level.SEVERE, "No handler registered, job marked FAILED: jobId=" + job.id()
          + ", type=" + job.type());
      return DispatchOutcome.UNKNOWN_TYPE;
    } catch (Exception e) {
      markFailed(job.id(), describe(e));
      metrics.incrementFailed();
      logger.log(Level.WARNING, "Job failed: jobId=" + job.id() + ", type=" + job.type(), e);
      return DispatchOutcome.FAILED;
    } catch (Error e) {
      markFailed(job.id(), describe(e));
      metrics.incrementFailed();
      logger.log(Level.SEVERE, "Job failed with error: jobId=" + job.id() + ", type=" + job.type(), e);
      if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
        throw e;
      }
      return DispatchOutcome.FAILED;
    } finally {
      long durationMs = Math.max(0L, (System.nanoTime() - start) / 1_000_000L);
      metrics.recordHandlerDurationMs(job.type(), durationMs);
    }
  }

  private Object deliver(Job job) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(job);
        completedBefore = i + 1;
      }

      JobHandler handler = handlerRegistry.handlerFor(job.type());
      if (handler == null) {
        throw new UnknownJobTypeException(job.type());
      }
      Map<String, Object> payload = jsonCodec.parseObject(job.payloadJson());
      Object result = handler.handle(payload);

      runAfterDispatch(job, null, completedBefore);
      return result;
    } catch (Exception | Error e) {
      runAfterDispatch(job, e, completedBefore);
      throw e;
    }
  }

  private void runAfterDispatch(Job job, Throwable error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(job, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  static String describe(Throwable failure) {
    String message = failure.getMessage();
    return message != null && !message.isBlank() ? message : failure.getClass().getName();
  }

  private void markCompleted(String jobId, String resultJson) {
    withConnection("mark COMPLETED", jobId,
        conn -> jobStore.markCompleted(conn, jobId, resultJson));
  }

  private void markFailed(String jobId, String error) {
    withConnection("mark FAILED", jobId,
        conn -> jobStore.markFailed(conn, jobId, error));
  }

  private void withConnection(String action, String jobId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      int updated = op.execute(conn);
      if (updated == 0) {
        logger.log(Level.WARNING, "Failed to " + action + " for jobId=" + jobId
            + ": job is no longer PROCESSING");
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for jobId=" + jobId, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    int execute(Connection conn) throws SQLException;
  }

  /** Builder for {@link JobDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private HandlerRegistry handlerRegistry;
    private JsonCodec jsonCodec;
    private MetricsExporter metrics;
    private final List<JobInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the connection provider used for status updates.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the job store used to mark jobs COMPLETED or FAILED.
     *
     * <p><b>Required.</b>
     *
     * @param jobStore the persistence backend
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the registry that maps job types to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the codec for payloads and results.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the JSON codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the metrics exporter for outcome counters and handler durations.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds an interceptor. Interceptors run in the order they are added.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(JobInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Adds several interceptors at once.
     *
     * @param interceptors the interceptors
     * @return this builder
     */
    public Builder interceptors(List<JobInterceptor> interceptors) {
      for (JobInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    public JobDispatcher build() {
      return new JobDispatcher(this);
    }
  }
}
