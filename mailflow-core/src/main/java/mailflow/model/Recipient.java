package mailflow.model;

/**
 * Input row for bulk registration. {@code customerId} is optional.
 */
public record Recipient(String campaignId, String email, String customerId) {

  public static Recipient of(String campaignId, String email) {
    return new Recipient(campaignId, email, null);
  }
}
