package jobqueue.content.draft;

import java.util.Optional;

/**
 * Supplies the author that generated drafts are assigned to when the job names none.
 */
@FunctionalInterface
public interface AuthorDirectory {

  /**
   * Directory without any author; drafts are only saved when the job names one.
   */
  AuthorDirectory NONE = Optional::empty;

  Optional<String> defaultAuthorId();
}
