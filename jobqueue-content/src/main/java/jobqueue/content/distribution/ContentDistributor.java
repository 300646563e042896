package jobqueue.content.distribution;

import java.util.List;

/**
 * Posts a piece of content to one external channel (a social network, a newsletter).
 */
public interface ContentDistributor {

  /**
   * Distributes the content to one channel.
   *
   * @param contentId the content to distribute
   * @param channel   the channel id
   * @throws Exception if the channel rejects the content or cannot be reached
   */
  void distribute(String contentId, String channel) throws Exception;

  /**
   * Channels used when a job names none. Defaults to none.
   */
  default List<String> defaultChannels() {
    return List.of();
  }
}
