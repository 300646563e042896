package jobqueue.jdbc.store;

import java.util.List;

/**
 * MySQL job store. Requires MySQL 8.0 or later for {@code SKIP LOCKED}; also matches TiDB
 * URLs.
 *
 * <p>MySQL cannot return rows from an {@code UPDATE}, so it uses the default two-phase claim
 * from {@link AbstractJdbcJobStore}: the locking {@code SELECT} and the status-guarded
 * {@code UPDATE} run inside the caller's transaction.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new MySqlJobStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }
}
