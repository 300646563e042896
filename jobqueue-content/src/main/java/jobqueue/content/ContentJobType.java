package jobqueue.content;

import jobqueue.JobType;

/**
 * Job types served by this module.
 */
public enum ContentJobType implements JobType {
  /** Payload {@code {topic, authorId?}}. */
  GENERATE_CONTENT,
  /** Payload {@code {contentId, channels?}}. */
  DISTRIBUTE_CONTENT
}
