package jobqueue;

import java.util.Map;

/**
 * Domain logic invoked by the dispatcher for one job type.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Returning normally completes the job; the returned value is serialized to JSON and
 *       stored as the job result ({@code null} is stored as an empty object).</li>
 *   <li>Throwing fails the job; the exception message is stored as the job error.</li>
 *   <li>The dispatcher never retries. A handler that calls an unreliable dependency retries
 *       internally, typically through {@link jobqueue.resilience.ResilientCaller}.</li>
 * </ul>
 *
 * <p>Handlers run on the worker thread, one job at a time per worker instance. A job may be
 * handed to a handler again only if an operator re-enqueues it, so handlers need not be
 * idempotent within one job id.
 *
 * @see jobqueue.registry.HandlerRegistry
 * @see jobqueue.dispatch.JobDispatcher
 */
@FunctionalInterface
public interface JobHandler {

  /**
   * Executes the job.
   *
   * @param payload the decoded payload object (never {@code null}, possibly empty)
   * @return the job result, serializable to a JSON object
   * @throws Exception to fail the job with a descriptive message
   */
  Object handle(Map<String, Object> payload) throws Exception;
}
