package mailflow.spi;

import mailflow.model.IssuedDiscount;

/**
 * Storefront mirror for customer tags and discount codes.
 *
 * <p>{@link #UNAVAILABLE} stands in when no storefront is connected; it accepts every call and
 * does nothing.
 */
public interface StorefrontClient {

  StorefrontClient UNAVAILABLE = new Unavailable();

  /**
   * Mirrors a tag onto the storefront customer.
   *
   * @param storefrontId the customer's id in the storefront
   * @param tag          tag to add
   */
  void tagCustomer(String storefrontId, String tag);

  /**
   * Registers a discount code with the storefront.
   *
   * @param storefrontId the customer's id in the storefront, or {@code null}
   * @param discount     the generated discount
   */
  default void createDiscount(String storefrontId, IssuedDiscount discount) {
  }

  default boolean isAvailable() {
    return true;
  }

  final class Unavailable implements StorefrontClient {
    private Unavailable() {
    }

    @Override
    public void tagCustomer(String storefrontId, String tag) {
    }

    @Override
    public boolean isAvailable() {
      return false;
    }
  }
}
