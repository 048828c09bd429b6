package mailflow.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a flow's ordered step list.
 *
 * <p>The hierarchy is closed: {@link #type()} identifies the variant and callers switch on it.
 * {@link Action} is the subset that may appear inside a {@link Condition} branch.
 */
public sealed interface Step permits Step.Action, Step.Wait, Step.Condition {

  StepType type();

  /** Steps that may also run as a condition branch action. */
  sealed interface Action extends Step permits SendEmail, AddTag, CreateDiscount {
  }

  record SendEmail(String subject, String templateId, String htmlContent) implements Action {
    public SendEmail {
      Objects.requireNonNull(subject, "subject");
    }

    @Override
    public StepType type() {
      return StepType.SEND_EMAIL;
    }
  }

  record Wait(long delayMinutes) implements Step {
    public Wait {
      if (delayMinutes < 0) {
        throw new IllegalArgumentException("delayMinutes must be >= 0, got: " + delayMinutes);
      }
    }

    @Override
    public StepType type() {
      return StepType.WAIT;
    }
  }

  /**
   * Branch on a customer predicate. {@code value} is the tag name or threshold the predicate
   * compares against; it is ignored by {@link ConditionType#HAS_PURCHASED}.
   */
  record Condition(ConditionType conditionType, String value,
      List<Action> ifTrue, List<Action> ifFalse) implements Step {
    public Condition {
      Objects.requireNonNull(conditionType, "conditionType");
      ifTrue = ifTrue == null ? List.of() : List.copyOf(ifTrue);
      ifFalse = ifFalse == null ? List.of() : List.copyOf(ifFalse);
    }

    @Override
    public StepType type() {
      return StepType.CONDITION;
    }
  }

  record AddTag(String tagName) implements Action {
    public AddTag {
      Objects.requireNonNull(tagName, "tagName");
    }

    @Override
    public StepType type() {
      return StepType.ADD_TAG;
    }
  }

  record CreateDiscount(String codePrefix, DiscountType discountType, BigDecimal value,
      int expiresInDays) implements Action {
    public CreateDiscount {
      Objects.requireNonNull(discountType, "discountType");
      Objects.requireNonNull(value, "value");
      if (expiresInDays < 0) {
        throw new IllegalArgumentException("expiresInDays must be >= 0, got: " + expiresInDays);
      }
    }

    @Override
    public StepType type() {
      return StepType.CREATE_DISCOUNT;
    }
  }
}
