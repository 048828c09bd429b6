package mailflow.support;

import mailflow.model.SendEntry;
import mailflow.model.SendStatus;
import mailflow.spi.SendLedgerStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Map-backed {@link SendLedgerStore} with the same conditional transitions as the JDBC stores.
 * Every method is synchronized, which stands in for the row lock.
 */
public class InMemorySendLedgerStore implements SendLedgerStore {
  private final Map<String, SendEntry> rows = new LinkedHashMap<>();

  @Override
  public synchronized boolean insertIfAbsent(Connection conn, SendEntry entry) {
    boolean exists = rows.containsKey(entry.jobKey()) || rows.values().stream()
        .anyMatch(r -> r.campaignId().equals(entry.campaignId()) && r.recipient().equals(entry.recipient()));
    if (exists) {
      return false;
    }
    rows.put(entry.jobKey(), entry);
    return true;
  }

  @Override
  public synchronized Optional<SendEntry> claim(Connection conn, String jobKey, String workerId,
      Instant now, Instant lockExpiry) {
    SendEntry row = rows.get(jobKey);
    if (row == null || !claimable(row, lockExpiry)) {
      return Optional.empty();
    }
    SendEntry claimed = copy(row, SendStatus.PROCESSING, workerId, now, row.attempts() + 1,
        row.lastError(), now, row.nextAttemptAt(), row.sentAt(), row.skippedAt(), row.externalMessageId(), now);
    rows.put(jobKey, claimed);
    return Optional.of(claimed);
  }

  @Override
  public synchronized boolean markSending(Connection conn, String jobKey, String workerId, Instant now) {
    return transition(jobKey, workerId, List.of(SendStatus.PROCESSING), r -> copy(r, SendStatus.SENDING,
        r.lockedBy(), r.lockedAt(), r.attempts(), r.lastError(), r.lastAttemptAt(), r.nextAttemptAt(),
        null, null, null, now));
  }

  @Override
  public synchronized boolean markSent(Connection conn, String jobKey, String workerId, String externalId,
      Instant now) {
    return transition(jobKey, workerId, List.of(SendStatus.PROCESSING, SendStatus.SENDING),
        r -> copy(r, SendStatus.SENT, null, null, r.attempts(), null, r.lastAttemptAt(), null,
            now, null, externalId, now));
  }

  @Override
  public synchronized Optional<SendStatus> markFailed(Connection conn, String jobKey, String workerId,
      String error, Instant now, Instant nextAttemptAt) {
    SendEntry row = rows.get(jobKey);
    if (!owned(row, workerId, List.of(SendStatus.PROCESSING, SendStatus.SENDING))) {
      return Optional.empty();
    }
    SendStatus status = row.attemptsExhausted() ? SendStatus.FAILED : SendStatus.PENDING;
    rows.put(jobKey, copy(row, status, null, null, row.attempts(), error, row.lastAttemptAt(),
        status == SendStatus.PENDING ? nextAttemptAt : null, null, null, null, now));
    return Optional.of(status);
  }

  @Override
  public synchronized boolean markSkipped(Connection conn, String jobKey, String workerId, String reason,
      Instant now) {
    return transition(jobKey, workerId, List.of(SendStatus.PROCESSING, SendStatus.SENDING),
        r -> copy(r, SendStatus.SKIPPED, null, null, r.attempts(), reason, r.lastAttemptAt(), null,
            null, now, null, now));
  }

  @Override
  public synchronized int recoverExpiredLocks(Connection conn, Instant lockExpiry, Instant now) {
    int recovered = 0;
    for (SendEntry row : List.copyOf(rows.values())) {
      if (row.status() == SendStatus.PROCESSING && row.lockedAt() != null && row.lockedAt().isBefore(lockExpiry)) {
        rows.put(row.jobKey(), copy(row, SendStatus.PENDING, null, null, row.attempts(), row.lastError(),
            row.lastAttemptAt(), now, null, null, null, now));
        recovered++;
      }
    }
    return recovered;
  }

  @Override
  public synchronized List<String> findClaimable(Connection conn, Instant now, Instant lockExpiry, int limit) {
    return rows.values().stream()
        .filter(r -> claimable(r, lockExpiry))
        .filter(r -> r.status() != SendStatus.PENDING || r.nextAttemptAt() == null || !r.nextAttemptAt().isAfter(now))
        .sorted(Comparator.comparing(SendEntry::createdAt))
        .limit(limit)
        .map(SendEntry::jobKey)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized Optional<SendEntry> find(Connection conn, String jobKey) {
    return Optional.ofNullable(rows.get(jobKey));
  }

  @Override
  public synchronized Map<SendStatus, Long> countByStatus(Connection conn, String campaignId) {
    Map<SendStatus, Long> counts = new EnumMap<>(SendStatus.class);
    rows.values().stream().filter(r -> r.campaignId().equals(campaignId))
        .forEach(r -> counts.merge(r.status(), 1L, Long::sum));
    return counts;
  }

  @Override
  public synchronized List<SendEntry> findFailed(Connection conn, String campaignId, int limit) {
    return rows.values().stream()
        .filter(r -> r.campaignId().equals(campaignId) && r.status() == SendStatus.FAILED)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized int resetFailed(Connection conn, String jobKey, Instant now) {
    SendEntry row = rows.get(jobKey);
    if (row == null || row.status() != SendStatus.FAILED) {
      return 0;
    }
    rows.put(jobKey, copy(row, SendStatus.PENDING, null, null, 0, row.lastError(), row.lastAttemptAt(), now,
        null, null, null, now));
    return 1;
  }

  @Override
  public synchronized int resetAllFailed(Connection conn, String campaignId, Instant now) {
    int reset = 0;
    for (SendEntry row : List.copyOf(rows.values())) {
      if (row.campaignId().equals(campaignId)) {
        reset += resetFailed(conn, row.jobKey(), now);
      }
    }
    return reset;
  }

  /** Test hook: overwrites a row, for example to age its lock. */
  public synchronized void put(SendEntry entry) {
    rows.put(entry.jobKey(), entry);
  }

  public synchronized int size() {
    return rows.size();
  }

  private boolean transition(String jobKey, String workerId, List<SendStatus> from, UnaryOperator<SendEntry> change) {
    SendEntry row = rows.get(jobKey);
    if (!owned(row, workerId, from)) {
      return false;
    }
    rows.put(jobKey, change.apply(row));
    return true;
  }

  private static boolean owned(SendEntry row, String workerId, List<SendStatus> from) {
    return row != null && from.contains(row.status()) && workerId.equals(row.lockedBy());
  }

  private static boolean claimable(SendEntry row, Instant lockExpiry) {
    switch (row.status()) {
      case PENDING:
        return true;
      case PROCESSING:
      case SENDING:
        return row.lockedAt() != null && row.lockedAt().isBefore(lockExpiry);
      case FAILED:
        return !row.attemptsExhausted();
      default:
        return false;
    }
  }

  private static SendEntry copy(SendEntry r, SendStatus status, String lockedBy, Instant lockedAt, int attempts,
      String lastError, Instant lastAttemptAt, Instant nextAttemptAt, Instant sentAt, Instant skippedAt,
      String externalId, Instant now) {
    return new SendEntry(r.jobKey(), r.campaignId(), r.recipient(), r.customerId(), status, lockedBy, lockedAt,
        r.version() + 1, attempts, r.maxAttempts(), lastError, lastAttemptAt, nextAttemptAt,
        sentAt != null ? sentAt : r.sentAt(), r.deliveredAt(), skippedAt != null ? skippedAt : r.skippedAt(),
        externalId != null ? externalId : r.externalMessageId(), r.createdAt(), now);
  }
}
