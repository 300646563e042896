package jobqueue.content;

/**
 * Thrown by a handler when the job payload is missing a required field or has the wrong shape.
 * Retrying the same payload cannot succeed.
 */
public class InvalidPayloadException extends IllegalArgumentException {

  public InvalidPayloadException(String message) {
    super(message);
  }
}
