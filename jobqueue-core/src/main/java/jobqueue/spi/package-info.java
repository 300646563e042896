/**
 * Service provider interfaces for persistence and observability.
 *
 * <p>Implement {@link jobqueue.spi.JobStore} for a custom backend and
 * {@link jobqueue.spi.MetricsExporter} to bridge into a monitoring system.
 *
 * @see jobqueue.spi.JobStore
 * @see jobqueue.spi.ConnectionProvider
 * @see jobqueue.spi.MetricsExporter
 */
package jobqueue.spi;
