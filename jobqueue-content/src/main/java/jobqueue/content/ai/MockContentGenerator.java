package jobqueue.content.ai;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic generator used when no AI provider is configured.
 */
public final class MockContentGenerator implements ContentGenerator {
  private final Clock clock;

  public MockContentGenerator() {
    this(Clock.systemUTC());
  }

  public MockContentGenerator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public GeneratedContent generate(String topic) {
    int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
    return new GeneratedContent(
        "The Ultimate Guide to " + topic + " (" + year + ")",
        "<h2>Introduction</h2><p>This comprehensive guide covers everything about " + topic + "...</p>",
        "Complete " + year + " guide to " + topic + ". Expert insights and practical tips.",
        List.of(topic, "Guide", String.valueOf(year)),
        topic + ": Complete Guide (" + year + ")",
        "Master " + topic + " with our comprehensive guide. Updated for " + year + ".");
  }
}
