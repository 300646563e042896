/**
 * Mapping from job type names to {@link jobqueue.JobHandler}s.
 */
package jobqueue.registry;
