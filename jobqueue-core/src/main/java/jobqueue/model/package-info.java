/**
 * Job record and lifecycle status.
 *
 * @see jobqueue.model.Job
 * @see jobqueue.model.JobStatus
 */
package jobqueue.model;
