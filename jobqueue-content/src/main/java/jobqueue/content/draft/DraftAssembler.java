package jobqueue.content.draft;

import jobqueue.content.ai.GeneratedContent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a {@link Draft} from generated content: slug, excerpt, reading time and SEO keywords.
 */
public final class DraftAssembler {
  static final int MAX_KEYWORDS = 10;
  static final int WORDS_PER_MINUTE = 200;
  static final int MAX_EXCERPT_LENGTH = 160;

  private static final Pattern TAG = Pattern.compile("<[^>]*>");
  private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
  private static final Pattern KEYWORD = Pattern.compile("\\b\\w{4,}\\b");
  private static final Pattern FIRST_PARAGRAPH = Pattern.compile("<p[^>]*>([^<]+)</p>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final Clock clock;

  public DraftAssembler() {
    this(Clock.systemUTC());
  }

  public DraftAssembler(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the draft for an author.
   *
   * @param generated complete generated content
   * @param topic     the requested topic, used for the slug when the content has no title
   * @param authorId  the owning author
   * @return the draft
   */
  public Draft assemble(GeneratedContent generated, String topic, String authorId) {
    String content = generated.content() == null ? "" : generated.content();
    String plainText = stripTags(content);
    String slugSource = firstNonBlank(generated.seoTitle(), generated.title(), topic, "post");
    return new Draft(
        generated.title(),
        content,
        excerpt(content, generated.summary()),
        slug(slugSource, clock.millis()),
        authorId,
        generated.seoTitle(),
        generated.seoDescription(),
        keywords(plainText, generated.tags()),
        readingTimeMinutes(plainText),
        generated.tags());
  }

  static String stripTags(String html) {
    return TAG.matcher(html).replaceAll("");
  }

  static String slug(String source, long epochMillis) {
    return NON_SLUG.matcher(source.toLowerCase(Locale.ROOT)).replaceAll("-") + "-" + epochMillis;
  }

  /**
   * Top {@value #MAX_KEYWORDS} words of four or more characters by frequency, ties in order
   * of first appearance, followed by the lower-cased tags.
   */
  static List<String> keywords(String plainText, List<String> tags) {
    Map<String, Integer> frequency = new LinkedHashMap<>();
    Matcher matcher = KEYWORD.matcher(plainText.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      frequency.merge(matcher.group(), 1, Integer::sum);
    }
    List<String> keywords = new ArrayList<>();
    frequency.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
        .limit(MAX_KEYWORDS)
        .forEach(e -> keywords.add(e.getKey()));
    for (String tag : tags) {
      keywords.add(tag.toLowerCase(Locale.ROOT));
    }
    return keywords;
  }

  static int readingTimeMinutes(String plainText) {
    int words = WHITESPACE.split(plainText).length;
    return (words + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE;
  }

  static String excerpt(String html, String summary) {
    Matcher matcher = FIRST_PARAGRAPH.matcher(html);
    String paragraph = matcher.find() ? matcher.group(1) : (summary == null ? "" : summary);
    if (paragraph.length() > MAX_EXCERPT_LENGTH) {
      return paragraph.substring(0, MAX_EXCERPT_LENGTH - 3) + "...";
    }
    return paragraph;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return "";
  }
}
