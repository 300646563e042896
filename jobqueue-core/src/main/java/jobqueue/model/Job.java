package jobqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only snapshot of a persisted job row.
 *
 * <p>{@code resultJson} and {@code error} are mutually exclusive: a completed job carries a
 * result, a failed job carries an error, a pending or processing job carries neither.
 *
 * @param id          unique identifier assigned at creation
 * @param type        discriminator selecting the handler
 * @param payloadJson JSON object interpreted only by the handler
 * @param status      lifecycle status
 * @param attempts    number of times the job has been claimed
 * @param lockedAt    time of the most recent claim, {@code null} while pending
 * @param resultJson  JSON result of a completed job
 * @param error       error message of a failed job
 * @param createdAt   creation time
 * @param processedAt time the job reached a terminal status
 */
public record Job(
    String id,
    String type,
    String payloadJson,
    JobStatus status,
    int attempts,
    Instant lockedAt,
    String resultJson,
    String error,
    Instant createdAt,
    Instant processedAt
) {

  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * Creates a new, unclaimed job.
   */
  public static Job pending(String id, String type, String payloadJson, Instant createdAt) {
    return new Job(id, type, payloadJson, JobStatus.PENDING, 0, null, null, null, createdAt, null);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
