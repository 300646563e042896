package jobqueue;

import jobqueue.model.Job;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Producer-side API: enqueues jobs and reads their status and result.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * String jobId = client.enqueue(ContentJobType.GENERATE_CONTENT, Map.of("topic", "Kotlin"));
 *
 * client.get(jobId)
 *     .filter(job -> job.status() == JobStatus.COMPLETED)
 *     .map(client::resultOf)
 *     .ifPresent(result -> show(result.get("title")));
 * }</pre>
 *
 * <p>{@link #enqueue(Connection, String, Object)} joins a transaction the caller already
 * holds, so a job can be written atomically with the business change that triggers it.
 */
public final class JobClient {
  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;

  public JobClient(ConnectionProvider connectionProvider, JobStore jobStore) {
    this(connectionProvider, jobStore, JsonCodec.getDefault(), MetricsExporter.NOOP);
  }

  public JobClient(ConnectionProvider connectionProvider, JobStore jobStore,
      JsonCodec jsonCodec, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.jsonCodec = jsonCodec != null ? jsonCodec : JsonCodec.getDefault();
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Enqueues a job in its own auto-committed statement.
   *
   * @param type    the job type
   * @param payload the payload, serialized to a JSON object ({@code null} becomes {@code {}})
   * @return the new job id
   * @throws JobQueueException if the job cannot be persisted
   */
  public String enqueue(JobType type, Object payload) {
    Objects.requireNonNull(type, "type");
    return enqueue(type.name(), payload);
  }

  /**
   * Enqueues a job in its own auto-committed statement.
   *
   * @param type    the job type name
   * @param payload the payload, serialized to a JSON object ({@code null} becomes {@code {}})
   * @return the new job id
   * @throws JobQueueException if the job cannot be persisted
   */
  public String enqueue(String type, Object payload) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return enqueue(conn, type, payload);
    } catch (SQLException e) {
      throw new JobQueueException("Failed to enqueue job of type " + type, e);
    }
  }

  /**
   * Enqueues a job on a connection owned by the caller. The job becomes visible to workers
   * when the caller commits.
   *
   * @param conn    the caller's connection
   * @param type    the job type name
   * @param payload the payload, serialized to a JSON object
   * @return the new job id
   */
  public String enqueue(Connection conn, String type, Object payload) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(type, "type");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type cannot be blank");
    }
    String id = UUID.randomUUID().toString();
    jobStore.insertNew(conn, Job.pending(id, type, jsonCodec.toJson(payload), Instant.now()));
    metrics.incrementEnqueued();
    return id;
  }

  /**
   * Looks up a job.
   *
   * @param jobId the job id
   * @return the job, or empty if unknown
   * @throws JobQueueException if the lookup fails
   */
  public Optional<Job> get(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.findById(conn, jobId);
    } catch (SQLException e) {
      throw new JobQueueException("Failed to load job " + jobId, e);
    }
  }

  /**
   * Decodes the result of a completed job. Empty for jobs without a result.
   */
  public Map<String, Object> resultOf(Job job) {
    return jsonCodec.parseObject(job.resultJson());
  }

  /**
   * Decodes the payload of a job.
   */
  public Map<String, Object> payloadOf(Job job) {
    return jsonCodec.parseObject(job.payloadJson());
  }
}
