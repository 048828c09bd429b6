package mailflow.model;

import java.time.Instant;

/**
 * Persisted send ledger row: the delivery state of one campaign message for one recipient.
 *
 * @see mailflow.spi.SendLedgerStore
 */
public record SendEntry(
    String jobKey,
    String campaignId,
    String recipient,
    String customerId,
    SendStatus status,
    String lockedBy,
    Instant lockedAt,
    long version,
    int attempts,
    int maxAttempts,
    String lastError,
    Instant lastAttemptAt,
    Instant nextAttemptAt,
    Instant sentAt,
    Instant deliveredAt,
    Instant skippedAt,
    String externalMessageId,
    Instant createdAt,
    Instant updatedAt
) {

  public boolean attemptsExhausted() {
    return attempts >= maxAttempts;
  }
}
