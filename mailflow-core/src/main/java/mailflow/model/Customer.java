package mailflow.model;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Read model of a customer, as supplied by {@link mailflow.spi.CustomerDirectory}.
 *
 * @param storefrontId external storefront id, or {@code null} when the customer is not mirrored
 */
public record Customer(
    String customerId,
    String email,
    Set<String> tags,
    BigDecimal totalSpent,
    int ordersCount,
    String storefrontId,
    boolean bounced,
    boolean unsubscribed
) {

  public Customer {
    tags = tags == null ? Set.of() : Set.copyOf(tags);
    totalSpent = totalSpent == null ? BigDecimal.ZERO : totalSpent;
  }

  public boolean hasTag(String tag) {
    return tags.contains(tag);
  }

  /** Address present and not suppressed by a bounce or unsubscribe. */
  public boolean isMailable() {
    return email != null && !email.isBlank() && !bounced && !unsubscribed;
  }
}
