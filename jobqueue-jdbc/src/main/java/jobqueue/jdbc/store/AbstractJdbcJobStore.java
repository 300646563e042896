package jobqueue.jdbc.store;

import jobqueue.jdbc.JdbcTemplate;
import jobqueue.model.Job;
import jobqueue.model.JobStatus;
import jobqueue.spi.JobStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>The default {@link #claimNext} is a two-phase claim that must run inside one transaction:
 * a {@code SELECT ... FOR UPDATE SKIP LOCKED} picks and locks the oldest pending row, then a
 * status-guarded {@code UPDATE} moves it to PROCESSING. Subclasses may override it with a
 * single-statement form, or with a per-row locking scan where the database applies
 * {@code LIMIT} before skipping locked rows. Every terminal update is guarded by {@code status = PROCESSING}, so
 * updates against any other status affect 0 rows.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/jobqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  protected static final String DEFAULT_TABLE = "job_queue";
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String COLUMNS =
      "job_id, job_type, payload, status, attempts, locked_at, result, last_error, created_at, processed_at";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> new Job(
      rs.getString("job_id"),
      rs.getString("job_type"),
      rs.getString("payload"),
      JobStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      toInstant(rs.getTimestamp("locked_at")),
      rs.getString("result"),
      rs.getString("last_error"),
      rs.getTimestamp("created_at").toInstant(),
      toInstant(rs.getTimestamp("processed_at")));

  private final String tableName;

  protected AbstractJdbcJobStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcJobStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind operating on another table.
   *
   * @param tableName the table name
   * @return a new store instance
   */
  public abstract AbstractJdbcJobStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  @Override
  public void insertNew(Connection conn, Job job) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "job_id, job_type, payload, status, attempts, locked_at, result, last_error, " +
        "created_at, processed_at" +
        ") VALUES (?,?,?,?,?,NULL,NULL,NULL,?,NULL)";
    JdbcTemplate.update(conn, sql,
        job.id(), job.type(), job.payloadJson() == null ? "{}" : job.payloadJson(),
        JobStatus.PENDING.code(), 0, job.createdAt());
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Instant now) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String selectSql = "SELECT job_id FROM " + tableName() +
        " WHERE status=" + JobStatus.PENDING.code() +
        " ORDER BY created_at, job_id LIMIT 1 FOR UPDATE SKIP LOCKED";
    List<String> ids = JdbcTemplate.query(conn, selectSql, rs -> rs.getString(1));
    if (ids.isEmpty()) {
      return Optional.empty();
    }
    String jobId = ids.get(0);
    if (markClaimed(conn, jobId, nowMs) == 0) {
      return Optional.empty();
    }
    return findById(conn, jobId);
  }

  /**
   * Moves a locked PENDING row to PROCESSING, stamping {@code locked_at} and bumping
   * {@code attempts}.
   *
   * @return rows updated, 0 if the job is no longer PENDING
   */
  protected int markClaimed(Connection conn, String jobId, Instant lockedAt) {
    String claimSql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PROCESSING.code() + ", locked_at=?, attempts=attempts+1" +
        " WHERE job_id=? AND status=" + JobStatus.PENDING.code();
    return JdbcTemplate.update(conn, claimSql, lockedAt, jobId);
  }

  @Override
  public int markCompleted(Connection conn, String jobId, String resultJson) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.COMPLETED.code() + ", result=?, processed_at=?" +
        " WHERE job_id=? AND status=" + JobStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql,
        resultJson == null ? "{}" : resultJson, Instant.now(), jobId);
  }

  @Override
  public int markFailed(Connection conn, String jobId, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.FAILED.code() + ", last_error=?, processed_at=?" +
        " WHERE job_id=? AND status=" + JobStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql,
        truncateError(error), Instant.now(), jobId);
  }

  @Override
  public Optional<Job> findById(Connection conn, String jobId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE job_id=?";
    return JdbcTemplate.queryFirst(conn, sql, JOB_ROW_MAPPER, jobId);
  }

  @Override
  public List<Job> queryByStatus(Connection conn, JobStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? ORDER BY created_at, job_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, status.code(), limit);
  }

  @Override
  public List<Job> queryStuck(Connection conn, Instant lockedBefore, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=" + JobStatus.PROCESSING.code() + " AND locked_at < ?" +
        " ORDER BY locked_at, job_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, lockedBefore, limit);
  }

  @Override
  public int countByStatus(Connection conn, JobStatus status) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE status=?";
    return JdbcTemplate.queryForInt(conn, sql, status.code());
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
