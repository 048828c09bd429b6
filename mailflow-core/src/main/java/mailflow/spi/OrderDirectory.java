package mailflow.spi;

/**
 * Read-only order lookups used by condition steps.
 */
@FunctionalInterface
public interface OrderDirectory {

  long countOrders(String customerId);
}
