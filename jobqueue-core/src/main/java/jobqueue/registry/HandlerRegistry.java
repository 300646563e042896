package jobqueue.registry;

import jobqueue.JobHandler;

import java.util.Set;

/**
 * Looks up the handler responsible for a job type.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Returns the handler for a job type.
   *
   * @param jobType the job type name
   * @return the handler, or {@code null} if none is registered
   */
  JobHandler handlerFor(String jobType);

  /**
   * Returns the names of all registered job types.
   */
  Set<String> registeredTypes();
}
