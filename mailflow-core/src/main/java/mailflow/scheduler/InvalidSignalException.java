package mailflow.scheduler;

/**
 * A step signal whose payload can never be processed. Never retried.
 */
public class InvalidSignalException extends RuntimeException {

  public InvalidSignalException(String message) {
    super(message);
  }
}
