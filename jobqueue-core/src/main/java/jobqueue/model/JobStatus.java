package jobqueue.model;

/**
 * Lifecycle status of a job. The only legal path is
 * {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 */
public enum JobStatus {
  PENDING(0),
  PROCESSING(1),
  COMPLETED(2),
  FAILED(3);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Returns {@code true} for {@link #COMPLETED} and {@link #FAILED}; terminal jobs are immutable.
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Resolves a status from its persisted code.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }
}
