package jobqueue.content.ai;

/**
 * Produces blog post content for a topic.
 */
@FunctionalInterface
public interface ContentGenerator {

  /**
   * Generates content for a topic.
   *
   * @param topic the non-blank topic
   * @return generated content, possibly incomplete if the provider returned partial data
   * @throws Exception if the provider cannot be reached or rejects the request
   */
  GeneratedContent generate(String topic) throws Exception;
}
