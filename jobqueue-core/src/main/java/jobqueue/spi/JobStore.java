package jobqueue.spi;

import jobqueue.model.Job;
import jobqueue.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for jobs, managing status transitions through the lifecycle
 * {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Implementations live in the {@code jobqueue-jdbc} module.
 *
 * @see jobqueue.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

  /**
   * Inserts a new job with status PENDING and zero attempts.
   *
   * @param conn the JDBC connection (may be part of the caller's transaction)
   * @param job  the job to persist, as built by {@link Job#pending}
   */
  void insertNew(Connection conn, Job job);

  /**
   * Atomically claims the oldest PENDING job: moves it to PROCESSING, sets {@code locked_at}
   * to {@code now} and increments {@code attempts}.
   *
   * <p>Implementations <strong>must</strong> skip rows locked by another in-flight claim
   * rather than block on them (e.g. {@code FOR UPDATE SKIP LOCKED}), so concurrent callers
   * never receive the same job. The caller must run this method inside a single
   * transaction ({@code autoCommit=false}) and commit afterwards.
   *
   * @param conn the JDBC connection, with auto-commit disabled
   * @param now  the claim timestamp
   * @return the claimed job in its PROCESSING state, or empty if no job is pending
   */
  Optional<Job> claimNext(Connection conn, Instant now);

  /**
   * Marks a PROCESSING job as COMPLETED and stores its result.
   *
   * @param conn       the JDBC connection
   * @param jobId      the job ID
   * @param resultJson the JSON-encoded result
   * @return the number of rows updated (0 if the job is not PROCESSING)
   */
  int markCompleted(Connection conn, String jobId, String resultJson);

  /**
   * Marks a PROCESSING job as FAILED and stores the error message.
   *
   * @param conn  the JDBC connection
   * @param jobId the job ID
   * @param error description of the failure (may be {@code null})
   * @return the number of rows updated (0 if the job is not PROCESSING)
   */
  int markFailed(Connection conn, String jobId, String error);

  /**
   * Looks up a job by ID.
   *
   * @param conn  the JDBC connection
   * @param jobId the job ID
   * @return the job, or empty if no such job exists
   */
  Optional<Job> findById(Connection conn, String jobId);

  /**
   * Queries jobs in the given status, oldest first.
   *
   * @param conn   the JDBC connection
   * @param status the status to match
   * @param limit  maximum number of jobs to return
   * @return matching jobs
   */
  default List<Job> queryByStatus(Connection conn, JobStatus status, int limit) {
    return List.of();
  }

  /**
   * Queries PROCESSING jobs whose claim is older than {@code lockedBefore}. The store never
   * reclaims such jobs; this exists so operators can find work held by a crashed worker.
   *
   * @param conn         the JDBC connection
   * @param lockedBefore claims made before this instant are reported
   * @param limit        maximum number of jobs to return
   * @return stuck jobs, oldest claim first
   */
  default List<Job> queryStuck(Connection conn, Instant lockedBefore, int limit) {
    return List.of();
  }

  /**
   * Counts jobs in the given status.
   *
   * @param conn   the JDBC connection
   * @param status the status to count
   * @return the number of matching jobs
   */
  default int countByStatus(Connection conn, JobStatus status) {
    return 0;
  }
}
