package jobqueue;

import jobqueue.admin.JobAdmin;
import jobqueue.dispatch.JobDispatcher;
import jobqueue.dispatch.JobInterceptor;
import jobqueue.registry.HandlerRegistry;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.util.JsonCodec;
import jobqueue.worker.JobWorker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link JobClient}, {@link JobDispatcher},
 * {@link JobWorker} and {@link JobAdmin} over one store into a single {@link AutoCloseable}
 * unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (JobEngine engine = JobEngine.builder()
 *     .connectionProvider(connProvider)
 *     .jobStore(JdbcJobStores.detect(dataSource))
 *     .handlerRegistry(registry)
 *     .intervalMs(1000)
 *     .build()) {
 *   engine.start();
 *   String jobId = engine.client().enqueue("GENERATE_CONTENT", Map.of("topic", "Kotlin"));
 * }
 * }</pre>
 *
 * <p>The worker is not started by {@link Builder#build()}; call {@link #start()} so that a
 * producer-only process can use the client without consuming jobs.
 *
 * @see JobClient
 * @see JobWorker
 */
public final class JobEngine implements AutoCloseable {
  private final JobClient client;
  private final JobDispatcher dispatcher;
  private final JobWorker worker;
  private final JobAdmin admin;
  private final MetricsExporter metrics;

  private JobEngine(JobClient client, JobDispatcher dispatcher, JobWorker worker,
      JobAdmin admin, MetricsExporter metrics) {
    this.client = client;
    this.dispatcher = dispatcher;
    this.worker = worker;
    this.admin = admin;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public JobClient client() {
    return client;
  }

  public JobDispatcher dispatcher() {
    return dispatcher;
  }

  public JobWorker worker() {
    return worker;
  }

  public JobAdmin admin() {
    return admin;
  }

  /**
   * Starts the worker's polling loop.
   */
  public void start() {
    worker.start();
  }

  /**
   * Stops the worker, then closes the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      worker.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link JobEngine}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private HandlerRegistry handlerRegistry;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private final List<JobInterceptor> interceptors = new ArrayList<>();
    private long intervalMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the connection provider for obtaining JDBC connections.
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
     * Sets the job store.
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
     * Sets the metrics exporter shared by all components.
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
     * Appends a dispatch interceptor.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(JobInterceptor interceptor) {
      Objects.requireNonNull(interceptor, "interceptor");
      this.interceptors.add(interceptor);
      return this;
    }

    /**
     * Sets the worker tick interval in milliseconds.
     *
     * <p>Optional. Defaults to {@code 5000}.
     *
     * @param intervalMs the tick interval
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Builds the engine. The worker is created but not started.
     *
     * @throws IllegalStateException if build() was already called
     */
    public JobEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(jobStore, "jobStore");
      Objects.requireNonNull(handlerRegistry, "handlerRegistry");
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      JsonCodec effectiveCodec = jsonCodec != null ? jsonCodec : JsonCodec.getDefault();

      JobDispatcher dispatcher = JobDispatcher.builder()
          .connectionProvider(connectionProvider)
          .jobStore(jobStore)
          .handlerRegistry(handlerRegistry)
          .jsonCodec(effectiveCodec)
          .metrics(effectiveMetrics)
          .interceptors(interceptors)
          .build();
      JobWorker worker = JobWorker.builder()
          .connectionProvider(connectionProvider)
          .jobStore(jobStore)
          .dispatcher(dispatcher)
          .intervalMs(intervalMs)
          .metrics(effectiveMetrics)
          .build();
      JobClient client = new JobClient(connectionProvider, jobStore, effectiveCodec, effectiveMetrics);
      JobAdmin admin = new JobAdmin(connectionProvider, jobStore);
      return new JobEngine(client, dispatcher, worker, admin, effectiveMetrics);
    }
  }
}
