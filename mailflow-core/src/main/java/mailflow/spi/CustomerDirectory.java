package mailflow.spi;

import mailflow.model.Customer;

import java.util.Optional;

/**
 * Access to customer records owned by the surrounding application.
 */
public interface CustomerDirectory {

  Optional<Customer> find(String customerId);

  /** Adds the tag if absent. */
  void addTag(String customerId, String tag);
}
