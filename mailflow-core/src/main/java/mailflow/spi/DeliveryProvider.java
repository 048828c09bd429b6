package mailflow.spi;

/**
 * Transport to an email provider.
 */
@FunctionalInterface
public interface DeliveryProvider {

  /**
   * Hands one message to the provider.
   *
   * @param recipient normalised recipient address
   * @param content   message to send
   * @return the provider's receipt
   * @throws DeliveryException if the provider rejected or could not be reached
   */
  DeliveryReceipt send(String recipient, MessageContent content) throws DeliveryException;
}
