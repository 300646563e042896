/**
 * Distribution of published content to external channels.
 */
package jobqueue.content.distribution;
