package jobqueue.demo;

import jobqueue.content.distribution.ContentDistributor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Pretends to post content; the channel {@code "fail"} always fails.
 */
public class LoggingContentDistributor implements ContentDistributor {

    private static final Logger log = LoggerFactory.getLogger(LoggingContentDistributor.class);

    private final List<String> defaultChannels;

    public LoggingContentDistributor(List<String> defaultChannels) {
        this.defaultChannels = List.copyOf(defaultChannels);
    }

    @Override
    public void distribute(String contentId, String channel) {
        if ("fail".equals(channel)) {
            throw new IllegalStateException("channel rejected the post");
        }
        log.info("[Social] posted {} to {}", contentId, channel);
    }

    @Override
    public List<String> defaultChannels() {
        return defaultChannels;
    }
}
