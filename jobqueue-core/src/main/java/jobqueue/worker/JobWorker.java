package jobqueue.worker;

import jobqueue.dispatch.JobDispatcher;
import jobqueue.model.Job;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled loop that claims one pending job per tick and dispatches it.
 *
 * <p>Each tick:
 * <ol>
 *   <li>Enters the busy guard. If the previous tick is still running the tick is skipped.</li>
 *   <li>Claims the oldest pending job in its own transaction
 *       ({@link JobStore#claimNext}), committing before dispatch.</li>
 *   <li>Dispatches the claimed job through {@link JobDispatcher}.</li>
 * </ol>
 *
 * <p>The busy guard belongs to this instance, so separate workers in one JVM tick
 * independently and compete only through the store's skip-locked claim. Any failure inside
 * a tick is logged and the loop keeps running; the guard is always released.
 *
 * <p>A job stays PROCESSING if its worker dies mid-dispatch. Nothing reclaims it; see
 * {@link jobqueue.admin.JobAdmin#queryStuck}.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()}, {@link #stop()} and
 * {@link #close()} are synchronized to prevent concurrent lifecycle transitions;
 * {@code stop()} can be followed by another {@code start()}, {@code close()} cannot.
 *
 * @see JobWorker.Builder
 */
public final class JobWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobWorker.class.getName());

    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final JobDispatcher dispatcher;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private JobWorker(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the fixed-rate polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("job-worker-"));
        pollTask = scheduler.scheduleAtFixedRate(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Job worker started, interval " + intervalMs + "ms");
    }

    /**
     * Executes a single tick. Called automatically by the scheduler, but may also be invoked
     * directly for testing.
     *
     * @return {@code true} if a job was claimed and dispatched
     */
    public boolean poll() {
        if (closed) {
            return false;
        }
        if (!busy.compareAndSet(false, true)) {
            metrics.incrementTickSkipped();
            return false;
        }
        try {
            Optional<Job> claimed = claim(Instant.now());
            if (claimed.isEmpty()) {
                return false;
            }
            Job job = claimed.get();
            metrics.incrementClaimed();
            dispatcher.dispatch(job);
            return true;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Worker tick failed", t);
            return false;
        } finally {
            busy.set(false);
        }
    }

    /**
     * Runs ticks back to back until no job is pending or {@code maxJobs} jobs were handled.
     *
     * @param maxJobs upper bound on the number of jobs to process
     * @return the number of jobs claimed and dispatched
     */
    public int drain(int maxJobs) {
        int processed = 0;
        while (processed < maxJobs && poll()) {
            processed++;
        }
        return processed;
    }

    /**
     * Returns {@code true} while a tick is executing.
     */
    public boolean isBusy() {
        return busy.get();
    }

    private Optional<Job> claim(Instant now) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            // SELECT ... FOR UPDATE and the status UPDATE must share one transaction
            conn.setAutoCommit(false);
            try {
                Optional<Job> claimed = jobStore.claimNext(conn, now);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread. The worker can be
     * started again afterwards. A job being dispatched at this moment is interrupted if it
     * does not finish within five seconds and may remain PROCESSING.
     */
    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            logger.info("Job worker stopped");
        }
    }

    /**
     * Returns {@code true} while the polling schedule is active.
     */
    public synchronized boolean isStarted() {
        return pollTask != null;
    }

    /**
     * Stops the worker permanently. Later {@link #start()} calls fail and {@link #poll()}
     * does nothing.
     */
    @Override
    public synchronized void close() {
        closed = true;
        stop();
    }

    /**
     * Builder for {@link JobWorker}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private JobDispatcher dispatcher;
        private long intervalMs = 5000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the connection provider for the claim transaction.
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
         * Sets the job store used to claim pending jobs.
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
         * Sets the dispatcher that runs claimed jobs.
         *
         * <p><b>Required.</b>
         *
         * @param dispatcher the dispatcher
         * @return this builder
         */
        public Builder dispatcher(JobDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Sets the tick interval in milliseconds.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param intervalMs tick interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the metrics exporter for claim and skipped-tick counters.
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

        public JobWorker build() {
            return new JobWorker(this);
        }
    }
}
