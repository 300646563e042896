package jobqueue.content;

import jobqueue.JobHandler;
import jobqueue.content.distribution.ContentDistributor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles {@link ContentJobType#DISTRIBUTE_CONTENT}: sends the payload's {@code contentId} to
 * each requested channel, or to the distributor's default channels when none is requested.
 *
 * <p>A failing channel is logged and reported in {@code failedChannels}; it never fails the
 * job. Result: {@code {success: true, channels, failedChannels}}.
 */
public final class DistributeContentHandler implements JobHandler {
  private static final Logger logger = Logger.getLogger(DistributeContentHandler.class.getName());

  private final ContentDistributor distributor;

  public DistributeContentHandler(ContentDistributor distributor) {
    this.distributor = Objects.requireNonNull(distributor, "distributor");
  }

  @Override
  public Object handle(Map<String, Object> payload) throws Exception {
    String contentId = Payloads.requiredString(payload, "contentId");
    List<String> channels = Payloads.stringList(payload, "channels");
    if (channels.isEmpty()) {
      channels = distributor.defaultChannels();
    }
    if (channels.isEmpty()) {
      logger.warning("No channels to distribute content " + contentId + " to");
    }

    List<String> failed = new ArrayList<>();
    for (String channel : channels) {
      try {
        distributor.distribute(contentId, channel);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw e;
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to distribute content " + contentId +
            " to channel " + channel, e);
        failed.add(channel);
      }
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("success", true);
    result.put("channels", channels);
    result.put("failedChannels", failed);
    return result;
  }
}
