package mailflow.model;

public enum DiscountType {
  PERCENTAGE,
  FIXED_AMOUNT
}
