/**
 * Shared utilities: daemon thread naming and JSON encoding of payloads and results.
 */
package jobqueue.util;
