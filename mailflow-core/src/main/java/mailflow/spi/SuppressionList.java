package mailflow.spi;

/**
 * Addresses that must not receive campaign mail (bounced or unsubscribed).
 */
@FunctionalInterface
public interface SuppressionList {

  SuppressionList NONE = recipient -> false;

  boolean isSuppressed(String recipient);
}
