package jobqueue.content.ai;

import java.util.List;

/**
 * Blog post content produced by a {@link ContentGenerator}.
 *
 * @param title          post title
 * @param content        HTML body
 * @param summary        short summary, may be {@code null}
 * @param tags           tag names (never {@code null})
 * @param seoTitle       search title, may be {@code null}
 * @param seoDescription search description, may be {@code null}
 */
public record GeneratedContent(
    String title,
    String content,
    String summary,
    List<String> tags,
    String seoTitle,
    String seoDescription
) {
  public GeneratedContent {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /**
   * Returns {@code true} when both title and content are present.
   */
  public boolean isComplete() {
    return title != null && !title.isBlank() && content != null && !content.isBlank();
  }
}
