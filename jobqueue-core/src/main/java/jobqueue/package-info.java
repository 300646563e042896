/**
 * Durable, database-backed job queue.
 *
 * <p>Producers schedule work through {@link jobqueue.JobClient}; a
 * {@link jobqueue.worker.JobWorker} claims one pending job per tick and hands it to the
 * {@link jobqueue.dispatch.JobDispatcher}, which routes it to the {@link jobqueue.JobHandler}
 * registered for the job's type. {@link jobqueue.JobEngine} wires these into a single
 * {@link java.lang.AutoCloseable} unit.
 *
 * @see jobqueue.JobEngine
 * @see jobqueue.JobClient
 * @see jobqueue.spi.JobStore
 */
package jobqueue;
