/**
 * Spring Boot auto-configuration for the job queue.
 *
 * <p>Given a {@link javax.sql.DataSource}, {@link jobqueue.spring.boot.JobQueueAutoConfiguration}
 * wires a {@link jobqueue.JobEngine} whose worker starts with the application context.
 * Handler beans annotated with {@link jobqueue.spring.boot.JobHandlerFor} are registered
 * automatically. Settings live under the {@code jobqueue.*} prefix
 * ({@link jobqueue.spring.boot.JobQueueProperties}).
 */
package jobqueue.spring.boot;
