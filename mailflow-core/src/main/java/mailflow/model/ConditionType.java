package mailflow.model;

/**
 * Predicates a {@link Step.Condition} can evaluate against a customer.
 */
public enum ConditionType {
  /** At least one order on record. */
  HAS_PURCHASED,
  /** Customer carries the tag given as the condition value. */
  HAS_TAG,
  /** Lifetime spend strictly above the condition value. */
  TOTAL_SPENT_GREATER,
  /** Order count strictly above the condition value. */
  ORDERS_COUNT_GREATER
}
