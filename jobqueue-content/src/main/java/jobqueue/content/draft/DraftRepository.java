package jobqueue.content.draft;

/**
 * Content storage for generated drafts.
 */
@FunctionalInterface
public interface DraftRepository {

  /**
   * Persists a draft.
   *
   * @param draft the draft to store
   * @return the id of the stored draft
   * @throws Exception if the draft cannot be stored
   */
  String save(Draft draft) throws Exception;
}
