/**
 * Draft records built from generated content, and the collaborators that store them.
 */
package jobqueue.content.draft;
