/**
 * Routing of claimed jobs to their handlers and recording of the terminal outcome.
 *
 * <p>{@link jobqueue.dispatch.JobDispatcher} never retries: a handler failure or an
 * unknown type moves the job straight to FAILED. Retrying transient failures is the job
 * of the handler, usually through {@link jobqueue.resilience.ResilientCaller}.
 */
package jobqueue.dispatch;
