package mailflow.flow;

import mailflow.model.ConditionType;
import mailflow.model.Customer;
import mailflow.model.Step;
import mailflow.support.InMemoryCustomers;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {
  private final InMemoryCustomers customers = new InMemoryCustomers();
  private final ConditionEvaluator evaluator = new ConditionEvaluator(customers);
  private final Customer customer = new Customer("c1", "a@x.com", Set.of("vip"), new BigDecimal("120.50"), 3,
      null, false, false);

  @Test
  void hasPurchasedAsksTheOrderDirectory() {
    assertFalse(evaluator.test(condition(ConditionType.HAS_PURCHASED, null), customer));

    customers.orders("c1", 1);
    assertTrue(evaluator.test(condition(ConditionType.HAS_PURCHASED, null), customer));
  }

  @Test
  void hasTagMatchesExactly() {
    assertTrue(evaluator.test(condition(ConditionType.HAS_TAG, "vip"), customer));
    assertFalse(evaluator.test(condition(ConditionType.HAS_TAG, "VIP"), customer));
    assertFalse(evaluator.test(condition(ConditionType.HAS_TAG, null), customer));
  }

  @Test
  void totalSpentIsStrictlyGreater() {
    assertTrue(evaluator.test(condition(ConditionType.TOTAL_SPENT_GREATER, "100"), customer));
    assertFalse(evaluator.test(condition(ConditionType.TOTAL_SPENT_GREATER, "120.50"), customer));
  }

  @Test
  void ordersCountIsStrictlyGreater() {
    assertTrue(evaluator.test(condition(ConditionType.ORDERS_COUNT_GREATER, "2"), customer));
    assertFalse(evaluator.test(condition(ConditionType.ORDERS_COUNT_GREATER, "3"), customer));
  }

  @Test
  void nonNumericThresholdIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> evaluator.test(condition(ConditionType.TOTAL_SPENT_GREATER, "lots"), customer));
    assertThrows(IllegalArgumentException.class,
        () -> evaluator.test(condition(ConditionType.ORDERS_COUNT_GREATER, null), customer));
  }

  private static Step.Condition condition(ConditionType type, String value) {
    return new Step.Condition(type, value, List.of(), List.of());
  }
}
