/**
 * Polling worker that claims pending jobs and hands them to the dispatcher.
 *
 * @see jobqueue.worker.JobWorker
 */
package jobqueue.worker;
