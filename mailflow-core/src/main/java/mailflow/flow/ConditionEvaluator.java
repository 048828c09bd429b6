package mailflow.flow;

import mailflow.model.Customer;
import mailflow.model.Step;
import mailflow.spi.OrderDirectory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Evaluates {@link Step.Condition} predicates against a customer.
 */
final class ConditionEvaluator {
  private final OrderDirectory orderDirectory;

  ConditionEvaluator(OrderDirectory orderDirectory) {
    this.orderDirectory = Objects.requireNonNull(orderDirectory, "orderDirectory");
  }

  /**
   * @throws IllegalArgumentException if a threshold condition has no numeric value
   */
  boolean test(Step.Condition condition, Customer customer) {
    String value = condition.value();
    return switch (condition.conditionType()) {
      case HAS_PURCHASED -> orderDirectory.countOrders(customer.customerId()) > 0;
      case HAS_TAG -> value != null && customer.hasTag(value);
      case TOTAL_SPENT_GREATER -> customer.totalSpent().compareTo(decimal(value)) > 0;
      case ORDERS_COUNT_GREATER -> customer.ordersCount() > decimal(value).longValue();
    };
  }

  private static BigDecimal decimal(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Condition threshold is missing");
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Condition threshold is not a number: " + value, e);
    }
  }
}
