/**
 * JDBC-based {@link jobqueue.spi.JobStore} implementations.
 *
 * <p>{@link jobqueue.jdbc.store.AbstractJdbcJobStore} provides shared SQL and row mapping
 * and a two-phase skip-locked claim (H2, MySQL 8); {@link jobqueue.jdbc.store.PostgresJobStore}
 * claims in a single {@code UPDATE ... RETURNING} round trip.
 *
 * @see jobqueue.jdbc.store.AbstractJdbcJobStore
 * @see jobqueue.jdbc.store.H2JobStore
 * @see jobqueue.jdbc.store.MySqlJobStore
 * @see jobqueue.jdbc.store.PostgresJobStore
 * @see jobqueue.jdbc.store.JdbcJobStores
 */
package jobqueue.jdbc.store;
