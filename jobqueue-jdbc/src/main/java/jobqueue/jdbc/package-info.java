/**
 * JDBC plumbing shared by the job stores: a {@link jobqueue.spi.ConnectionProvider} over a
 * {@link javax.sql.DataSource} and a small statement helper.
 *
 * @see jobqueue.jdbc.store
 */
package jobqueue.jdbc;
