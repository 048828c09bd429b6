package mailflow.spi;

import mailflow.model.SendEntry;
import mailflow.model.SendStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for send ledger rows. Every state change is a single conditional statement,
 * so two callers racing on the same row can never both succeed.
 *
 * <p>Implementations throw {@link StoreException} on database errors.
 *
 * @see mailflow.ledger.SendLedger
 */
public interface SendLedgerStore {

  /**
   * Inserts the entry unless a row with the same job key or the same (campaign, recipient)
   * already exists.
   *
   * @return {@code true} if this call created the row, {@code false} if it already existed
   */
  boolean insertIfAbsent(Connection conn, SendEntry entry);

  /**
   * Inserts every entry that does not already exist, in one round trip where the database
   * allows it. The caller runs this inside a transaction and rolls it back if this throws.
   *
   * @return one flag per entry, in order, {@code true} where that entry created its row
   */
  default List<Boolean> insertAllIfAbsent(Connection conn, List<SendEntry> entries) {
    List<Boolean> created = new ArrayList<>(entries.size());
    for (SendEntry entry : entries) {
      created.add(insertIfAbsent(conn, entry));
    }
    return created;
  }

  /**
   * Takes the lock on a row that is {@code PENDING}, or {@code PROCESSING}/{@code SENDING} with a
   * lock older than {@code lockExpiry}, or {@code FAILED} with attempts remaining. Sets status
   * {@code PROCESSING}, the lock fields and {@code last_attempt_at}, and increments
   * {@code version} and {@code attempts} in the same statement.
   *
   * @return the claimed row, or empty if the row is missing or held by someone else
   */
  Optional<SendEntry> claim(Connection conn, String jobKey, String workerId, Instant now,
      Instant lockExpiry);

  /** {@code PROCESSING -> SENDING} for the lock owner. */
  boolean markSending(Connection conn, String jobKey, String workerId, Instant now);

  /** {@code PROCESSING|SENDING -> SENT} for the lock owner; clears the lock and last error. */
  boolean markSent(Connection conn, String jobKey, String workerId, String externalId, Instant now);

  /**
   * Releases the lock after a failed attempt: {@code FAILED} when attempts are exhausted,
   * otherwise {@code PENDING} with {@code next_attempt_at} set.
   *
   * @return the resulting status, or empty if the caller no longer owns the row
   */
  Optional<SendStatus> markFailed(Connection conn, String jobKey, String workerId, String error,
      Instant now, Instant nextAttemptAt);

  /** {@code PROCESSING|SENDING -> SKIPPED} for the lock owner; clears the lock. */
  boolean markSkipped(Connection conn, String jobKey, String workerId, String reason, Instant now);

  /**
   * Resets {@code PROCESSING} rows whose lock is older than {@code lockExpiry} to {@code PENDING}.
   *
   * @return number of rows reset
   */
  int recoverExpiredLocks(Connection conn, Instant lockExpiry, Instant now);

  /**
   * Job keys a worker could claim right now, oldest first.
   */
  List<String> findClaimable(Connection conn, Instant now, Instant lockExpiry, int limit);

  Optional<SendEntry> find(Connection conn, String jobKey);

  Map<SendStatus, Long> countByStatus(Connection conn, String campaignId);

  List<SendEntry> findFailed(Connection conn, String campaignId, int limit);

  /** {@code FAILED -> PENDING} with attempts reset, for one row. */
  int resetFailed(Connection conn, String jobKey, Instant now);

  /** {@code FAILED -> PENDING} with attempts reset, for a whole campaign. */
  int resetAllFailed(Connection conn, String campaignId, Instant now);
}
