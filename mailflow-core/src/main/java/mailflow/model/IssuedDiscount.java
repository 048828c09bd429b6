package mailflow.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Discount generated for a customer by a {@link Step.CreateDiscount} step.
 */
public record IssuedDiscount(String code, DiscountType type, BigDecimal value, Instant expiresAt) {
}
