/**
 * Micrometer bridge for exporting job queue metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link jobqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link jobqueue.spi.MetricsExporter} SPI using Micrometer counters, timers and gauges.
 *
 * @see jobqueue.micrometer.MicrometerMetricsExporter
 */
package jobqueue.micrometer;
