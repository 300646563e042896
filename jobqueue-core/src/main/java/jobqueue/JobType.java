package jobqueue;

/**
 * Type-safe job type identifier. Typically implemented by an enum:
 *
 * <pre>{@code
 * enum ContentJobType implements JobType {
 *   GENERATE_CONTENT, DISTRIBUTE_CONTENT
 * }
 * }</pre>
 *
 * <p>{@link #name()} is the string persisted in the job row and used for handler lookup.
 */
public interface JobType {

  /**
   * Returns the job type name used for routing.
   */
  String name();
}
