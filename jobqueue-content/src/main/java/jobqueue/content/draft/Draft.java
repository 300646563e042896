package jobqueue.content.draft;

import java.util.List;

/**
 * Unpublished post assembled from generated content.
 *
 * @param title              post title
 * @param content            HTML body
 * @param excerpt            first paragraph (or summary), at most 160 characters
 * @param slug               URL slug, unique per creation time
 * @param authorId           owning author
 * @param seoTitle           search title
 * @param seoDescription     search description
 * @param seoKeywords        most frequent content words followed by the lower-cased tags
 * @param readingTimeMinutes estimated reading time at 200 words per minute
 * @param tags               tag names
 */
public record Draft(
    String title,
    String content,
    String excerpt,
    String slug,
    String authorId,
    String seoTitle,
    String seoDescription,
    List<String> seoKeywords,
    int readingTimeMinutes,
    List<String> tags
) {
  public Draft {
    seoKeywords = List.copyOf(seoKeywords);
    tags = List.copyOf(tags);
  }
}
