/**
 * Operator tools for inspecting failed and stuck jobs.
 */
package jobqueue.admin;
