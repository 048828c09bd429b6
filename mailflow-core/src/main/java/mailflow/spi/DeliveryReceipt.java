package mailflow.spi;

/**
 * Provider acknowledgement of an accepted message.
 */
public record DeliveryReceipt(String externalId) {
}
