package jobqueue.admin;

import jobqueue.model.Job;
import jobqueue.model.JobStatus;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for querying, counting, and re-enqueueing failed jobs, and for finding
 * jobs stuck in PROCESSING after a worker crash.
 *
 * <p>Terminal rows are never modified. {@link #reEnqueue} inserts a fresh PENDING copy of a
 * failed job under a new id.
 *
 * @see JobStore#queryByStatus
 * @see JobStore#queryStuck
 * @see JobStore#countByStatus
 */
public final class JobAdmin {
  private static final Logger logger = Logger.getLogger(JobAdmin.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;

  public JobAdmin(ConnectionProvider connectionProvider, JobStore jobStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
  }

  /**
   * Queries FAILED jobs, oldest first.
   *
   * @param limit maximum number of jobs to return
   * @return failed jobs
   */
  public List<Job> queryFailed(int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.queryByStatus(conn, JobStatus.FAILED, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query failed jobs", e);
      return List.of();
    }
  }

  /**
   * Queries PROCESSING jobs claimed longer ago than {@code olderThan}.
   *
   * @param olderThan minimum claim age
   * @param limit     maximum number of jobs to return
   * @return stuck jobs, oldest claim first
   */
  public List<Job> queryStuck(Duration olderThan, int limit) {
    Objects.requireNonNull(olderThan, "olderThan");
    Instant lockedBefore = Instant.now().minus(olderThan);
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.queryStuck(conn, lockedBefore, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query stuck jobs", e);
      return List.of();
    }
  }

  /**
   * Counts jobs in a status.
   *
   * @param status the status to count
   * @return the number of jobs
   */
  public int count(JobStatus status) {
    Objects.requireNonNull(status, "status");
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.countByStatus(conn, status);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count " + status + " jobs", e);
      return 0;
    }
  }

  /**
   * Enqueues a new PENDING job with the type and payload of a FAILED job.
   *
   * @param failedJobId the id of the failed job
   * @return the new job id, or empty if the job does not exist or is not FAILED
   */
  public Optional<String> reEnqueue(String failedJobId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<Job> original = jobStore.findById(conn, failedJobId);
      if (original.isEmpty() || original.get().status() != JobStatus.FAILED) {
        return Optional.empty();
      }
      Job failed = original.get();
      String newId = UUID.randomUUID().toString();
      jobStore.insertNew(conn, Job.pending(newId, failed.type(), failed.payloadJson(), Instant.now()));
      logger.info("Re-enqueued failed job " + failedJobId + " as " + newId);
      return Optional.of(newId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to re-enqueue job: " + failedJobId, e);
      return Optional.empty();
    }
  }
}
