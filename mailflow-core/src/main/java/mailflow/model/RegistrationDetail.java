package mailflow.model;

/**
 * Per-recipient note produced by bulk registration for anything that was not a plain insert.
 */
public record RegistrationDetail(Kind kind, String campaignId, String email, String jobKey, String message) {

  public enum Kind {
    /** Missing campaign id or address, or an address that does not look like one. */
    INVALID,
    /** Same (campaign, address), and so the same job key, seen earlier in the batch. */
    DUPLICATE_RECIPIENT,
    /** Row already present in the ledger. */
    ALREADY_REGISTERED,
    /** Insert failed for a reason other than a duplicate. */
    WRITE_ERROR
  }
}
