package mailflow.spi;

/**
 * Thrown by a {@link DeliveryProvider} when a message could not be handed over.
 * Treated as transient: the ledger and the step scheduler retry within their attempt budget.
 */
public class DeliveryException extends Exception {

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
