package jobqueue.content;

import jobqueue.JobHandler;
import jobqueue.content.ai.ContentGenerator;
import jobqueue.content.ai.GeneratedContent;
import jobqueue.content.draft.AuthorDirectory;
import jobqueue.content.draft.Draft;
import jobqueue.content.draft.DraftAssembler;
import jobqueue.content.draft.DraftRepository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Handles {@link ContentJobType#GENERATE_CONTENT}: generates a post for the payload's
 * {@code topic}, saves it as a draft and returns the generated metadata.
 *
 * <p>The draft is owned by the payload's {@code authorId} or, if absent, the directory's
 * default author. Without any author the draft is not saved and the job still completes.
 *
 * <p>Result: {@code {title, content, summary, tags, seoTitle, seoDescription, draftId?}}.
 */
public final class GenerateContentHandler implements JobHandler {
  private static final Logger logger = Logger.getLogger(GenerateContentHandler.class.getName());

  static final String INVALID_CONTENT = "AI generation returned invalid content";

  private final ContentGenerator generator;
  private final DraftRepository drafts;
  private final AuthorDirectory authors;
  private final DraftAssembler assembler;

  public GenerateContentHandler(ContentGenerator generator, DraftRepository drafts,
      AuthorDirectory authors) {
    this(generator, drafts, authors, new DraftAssembler());
  }

  public GenerateContentHandler(ContentGenerator generator, DraftRepository drafts,
      AuthorDirectory authors, DraftAssembler assembler) {
    this.generator = Objects.requireNonNull(generator, "generator");
    this.drafts = Objects.requireNonNull(drafts, "drafts");
    this.authors = Objects.requireNonNull(authors, "authors");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
  }

  @Override
  public Object handle(Map<String, Object> payload) throws Exception {
    String topic = Payloads.requiredString(payload, "topic");
    GeneratedContent generated = generator.generate(topic);
    if (generated == null || !generated.isComplete()) {
      throw new IllegalStateException(INVALID_CONTENT);
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("title", generated.title());
    result.put("content", generated.content());
    result.put("summary", generated.summary());
    result.put("tags", generated.tags());
    result.put("seoTitle", generated.seoTitle());
    result.put("seoDescription", generated.seoDescription());

    Optional<String> authorId = Optional.ofNullable(Payloads.optionalString(payload, "authorId"))
        .filter(id -> !id.isBlank())
        .or(authors::defaultAuthorId);
    if (authorId.isPresent()) {
      Draft draft = assembler.assemble(generated, topic, authorId.get());
      String draftId = drafts.save(draft);
      result.put("draftId", draftId);
      logger.info("Draft created: " + draft.slug());
    } else {
      logger.warning("No author found to assign the draft to; draft not saved");
    }
    return result;
  }
}
