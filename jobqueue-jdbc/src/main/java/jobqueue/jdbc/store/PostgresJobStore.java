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
 * PostgreSQL job store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new PostgresJobStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Instant now) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PROCESSING.code() + ", locked_at=?, attempts=attempts+1" +
        " WHERE job_id = (" +
        "SELECT job_id FROM " + tableName() +
        " WHERE status=" + JobStatus.PENDING.code() +
        " ORDER BY created_at, job_id LIMIT 1" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<Job> claimed = JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER, nowMs);
    return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
  }
}
