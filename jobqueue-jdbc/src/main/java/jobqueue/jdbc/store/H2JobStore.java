package jobqueue.jdbc.store;

import jobqueue.jdbc.JdbcTemplate;
import jobqueue.model.Job;
import jobqueue.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * H2 job store. Primarily for testing and the demo application.
 *
 * <p>H2 applies {@code LIMIT} before {@code SKIP LOCKED}, so the default
 * {@code ORDER BY ... LIMIT 1 FOR UPDATE SKIP LOCKED} returns nothing while another
 * transaction holds the oldest row. This store instead reads a window of pending ids
 * without locking and then locks them one at a time with {@code SKIP LOCKED}, claiming the
 * first row it manages to lock. Windows are paged until a row is claimed or the pending
 * backlog is exhausted.
 */
public final class H2JobStore extends AbstractJdbcJobStore {
  static final int CANDIDATE_WINDOW = 32;

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new H2JobStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Instant now) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String candidatesSql = "SELECT job_id FROM " + tableName() +
        " WHERE status=" + JobStatus.PENDING.code() +
        " ORDER BY created_at, job_id LIMIT " + CANDIDATE_WINDOW + " OFFSET ?";
    String lockSql = "SELECT job_id FROM " + tableName() +
        " WHERE job_id=? AND status=" + JobStatus.PENDING.code() + " FOR UPDATE SKIP LOCKED";

    for (int offset = 0; ; offset += CANDIDATE_WINDOW) {
      List<String> candidates = JdbcTemplate.query(conn, candidatesSql, rs -> rs.getString(1), offset);
      for (String jobId : candidates) {
        if (JdbcTemplate.query(conn, lockSql, rs -> rs.getString(1), jobId).isEmpty()) {
          continue;
        }
        if (markClaimed(conn, jobId, nowMs) == 1) {
          return findById(conn, jobId);
        }
      }
      if (candidates.size() < CANDIDATE_WINDOW) {
        return Optional.empty();
      }
    }
  }
}
