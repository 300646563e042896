package jobqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Locates the job store for a database, optionally bound to a non-default queue table.
 *
 * <p>Stores are discovered with {@link ServiceLoader} from
 * {@code META-INF/services/jobqueue.jdbc.store.AbstractJdbcJobStore} and matched by JDBC URL
 * prefix or by {@link AbstractJdbcJobStore#name()}. The registered instances use the default
 * {@code job_queue} table; the {@code tableName} overloads return a store bound to the
 * requested table instead.
 *
 * <pre>{@code
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource, "cms_jobs");
 * AbstractJdbcJobStore h2 = JdbcJobStores.get("h2");
 * }</pre>
 */
public final class JdbcJobStores {

  private static final List<AbstractJdbcJobStore> STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private JdbcJobStores() {
  }

  /**
   * Returns all registered job stores, each bound to the default table.
   */
  public static List<AbstractJdbcJobStore> all() {
    return STORES;
  }

  /**
   * Gets a job store by name.
   *
   * @param name job store name (case-insensitive)
   * @return the job store
   * @throws IllegalArgumentException if no job store has that name
   */
  public static AbstractJdbcJobStore get(String name) {
    String wanted = name.toLowerCase(Locale.ROOT);
    return STORES.stream()
        .filter(store -> store.name().toLowerCase(Locale.ROOT).equals(wanted))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown job store: " + name
            + ". Available: " + STORES.stream().map(AbstractJdbcJobStore::name).toList()));
  }

  /**
   * Detects the job store from the URL of a connection borrowed from {@code dataSource}.
   *
   * @throws IllegalStateException if the connection or its metadata cannot be read
   * @throws IllegalArgumentException if no store handles the URL
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    return detect(jdbcUrlOf(dataSource));
  }

  /**
   * Detects the job store for {@code dataSource} and binds it to {@code tableName}.
   *
   * @param dataSource the data source holding the queue table
   * @param tableName the queue table, validated by the store
   * @return a store operating on {@code tableName}
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource, String tableName) {
    return bind(detect(dataSource), tableName);
  }

  /**
   * Detects the job store from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is null, empty or not handled by any store
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No job store found for JDBC URL: " + jdbcUrl + ". Supported prefixes: "
            + STORES.stream().flatMap(s -> s.jdbcUrlPrefixes().stream()).toList()));
  }

  /**
   * Detects the job store from a JDBC URL and binds it to {@code tableName}.
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl, String tableName) {
    return bind(detect(jdbcUrl), tableName);
  }

  private static Optional<AbstractJdbcJobStore> find(String jdbcUrl) {
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return STORES.stream()
        .filter(store -> store.jdbcUrlPrefixes().stream()
            .anyMatch(prefix -> url.startsWith(prefix.toLowerCase(Locale.ROOT))))
        .findFirst();
  }

  private static AbstractJdbcJobStore bind(AbstractJdbcJobStore store, String tableName) {
    return store.tableName().equals(tableName) ? store : store.withTableName(tableName);
  }

  private static String jdbcUrlOf(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read JDBC URL from DataSource", e);
    }
  }
}
