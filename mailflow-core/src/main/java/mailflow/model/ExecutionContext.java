package mailflow.model;

/**
 * Data carried between the steps of one execution. Each field is written by exactly one step
 * type; {@code null} means that step has not run.
 *
 * @param discount      written by {@link Step.CreateDiscount}
 * @param lastMessageId provider message id written by {@link Step.SendEmail}
 */
public record ExecutionContext(IssuedDiscount discount, String lastMessageId) {

  public static final ExecutionContext EMPTY = new ExecutionContext(null, null);

  public ExecutionContext withDiscount(IssuedDiscount discount) {
    return new ExecutionContext(discount, lastMessageId);
  }

  public ExecutionContext withLastMessageId(String messageId) {
    return new ExecutionContext(discount, messageId);
  }
}
