package mailflow.flow;

import java.util.Locale;

/**
 * Per-customer discount codes: {@code PREFIX_CUSTOMERID}, upper-cased.
 *
 * <p>Codes are reproducible from the prefix and the customer id, which also makes them
 * guessable by anyone who knows both.
 */
public final class DiscountCodes {
  static final String DEFAULT_PREFIX = "FLOW";

  private DiscountCodes() {
  }

  public static String codeFor(String prefix, String customerId) {
    String effectivePrefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
    return (effectivePrefix + "_" + customerId).toUpperCase(Locale.ROOT);
  }
}
