package mailflow.spi;

/**
 * Unchecked exception wrapping JDBC errors raised by store implementations and by the
 * components that obtain connections for them.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
