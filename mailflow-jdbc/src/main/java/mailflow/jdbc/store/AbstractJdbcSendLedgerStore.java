package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.SendEntry;
import mailflow.model.SendStatus;
import mailflow.spi.SendLedgerStore;
import mailflow.spi.StoreException;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC send ledger store with standard SQL implementations.
 *
 * <p>Every transition is one UPDATE whose WHERE clause carries the expected status and, for
 * owner-only transitions, the expected {@code locked_by}. Subclasses supply the
 * insert-if-absent statement and may override {@link #claim} with a single-round-trip form.
 * Register custom implementations via
 * {@code META-INF/services/mailflow.jdbc.store.AbstractJdbcSendLedgerStore}.
 *
 * @see JdbcStores
 */
public abstract class AbstractJdbcSendLedgerStore implements SendLedgerStore, VendorSpecific {
  protected static final String TABLE = "send_ledger";

  protected static final String COLUMNS = "job_key, campaign_id, recipient, customer_id, status, " +
      "locked_by, locked_at, version, attempts, max_attempts, last_error, last_attempt_at, " +
      "next_attempt_at, sent_at, delivered_at, skipped_at, external_message_id, created_at, updated_at";

  protected static final String INSERT_VALUES = " (" + COLUMNS + ") VALUES " +
      "(?,?,?,?,?,NULL,NULL,0,0,?,NULL,NULL,?,NULL,NULL,NULL,NULL,?,?)";

  protected static final String LOCKED_STATUS_IN =
      "(" + SendStatus.PROCESSING.code() + "," + SendStatus.SENDING.code() + ")";

  /** PENDING, an abandoned lock, or FAILED with attempts left. Parameter: lock expiry. */
  protected static final String CLAIMABLE =
      "(status=" + SendStatus.PENDING.code() +
      " OR (status IN " + LOCKED_STATUS_IN + " AND locked_at < ?)" +
      " OR (status=" + SendStatus.FAILED.code() + " AND attempts < max_attempts))";

  protected static final String CLAIM_SET = " SET status=" + SendStatus.PROCESSING.code() +
      ", locked_by=?, locked_at=?, last_attempt_at=?, updated_at=?, version=version+1, attempts=attempts+1";

  protected static final JdbcTemplate.RowMapper<SendEntry> ENTRY_ROW_MAPPER = rs -> new SendEntry(
      rs.getString("job_key"),
      rs.getString("campaign_id"),
      rs.getString("recipient"),
      rs.getString("customer_id"),
      SendStatus.fromCode(rs.getInt("status")),
      rs.getString("locked_by"),
      JdbcTemplate.instant(rs, "locked_at"),
      rs.getLong("version"),
      rs.getInt("attempts"),
      rs.getInt("max_attempts"),
      rs.getString("last_error"),
      JdbcTemplate.instant(rs, "last_attempt_at"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      JdbcTemplate.instant(rs, "sent_at"),
      JdbcTemplate.instant(rs, "delivered_at"),
      JdbcTemplate.instant(rs, "skipped_at"),
      rs.getString("external_message_id"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  /** Parameters shared by every {@link #INSERT_VALUES} statement. */
  protected static Object[] insertParams(SendEntry entry) {
    return new Object[]{entry.jobKey(), entry.campaignId(), entry.recipient(), entry.customerId(),
        SendStatus.PENDING.code(), entry.maxAttempts(), entry.nextAttemptAt(), entry.createdAt(), entry.updatedAt()};
  }

  /**
   * Runs an insert-if-absent statement for every entry as one batch.
   *
   * @throws StoreException if the driver does not report a count for each row
   */
  protected static List<Boolean> batchInsert(Connection conn, String sql, List<SendEntry> entries) {
    List<Object[]> params = new ArrayList<>(entries.size());
    for (SendEntry entry : entries) {
      params.add(insertParams(entry));
    }
    int[] counts = JdbcTemplate.batchUpdate(conn, sql, params);
    if (counts.length != entries.size()) {
      throw new StoreException("Batch returned " + counts.length + " counts for " + entries.size() + " rows");
    }
    List<Boolean> created = new ArrayList<>(counts.length);
    for (int count : counts) {
      if (count == Statement.SUCCESS_NO_INFO || count == Statement.EXECUTE_FAILED) {
        throw new StoreException("Batch did not report per-row counts");
      }
      created.add(count == 1);
    }
    return created;
  }

  @Override
  public Optional<SendEntry> claim(Connection conn, String jobKey, String workerId, Instant now,
      Instant lockExpiry) {
    Objects.requireNonNull(workerId, "workerId");
    // Truncate to millis so the stored value matches the follow-up select
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + TABLE + CLAIM_SET + " WHERE job_key=? AND " + CLAIMABLE;
    int updated = JdbcTemplate.update(conn, sql, workerId, nowMs, nowMs, nowMs, jobKey, lockExpiry);
    if (updated == 0) {
      return Optional.empty();
    }
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE job_key=? AND locked_by=? AND locked_at=?",
        ENTRY_ROW_MAPPER, jobKey, workerId, nowMs);
  }

  @Override
  public boolean markSending(Connection conn, String jobKey, String workerId, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + SendStatus.SENDING.code() +
        ", updated_at=?, version=version+1" +
        " WHERE job_key=? AND locked_by=? AND status=" + SendStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql, now, jobKey, workerId) == 1;
  }

  @Override
  public boolean markSent(Connection conn, String jobKey, String workerId, String externalId, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + SendStatus.SENT.code() +
        ", external_message_id=?, sent_at=?, last_error=NULL, next_attempt_at=NULL" +
        ", locked_by=NULL, locked_at=NULL, updated_at=?, version=version+1" +
        " WHERE job_key=? AND locked_by=? AND status IN " + LOCKED_STATUS_IN;
    return JdbcTemplate.update(conn, sql, externalId, now, now, jobKey, workerId) == 1;
  }

  @Override
  public Optional<SendStatus> markFailed(Connection conn, String jobKey, String workerId, String error,
      Instant now, Instant nextAttemptAt) {
    String ownedBy = " WHERE job_key=? AND locked_by=? AND status IN " + LOCKED_STATUS_IN;
    // attempts only changes on claim, which also changes locked_by, so the owner can read it first
    Optional<Boolean> exhausted = JdbcTemplate.queryOne(conn,
        "SELECT attempts, max_attempts FROM " + TABLE + ownedBy,
        rs -> rs.getInt("attempts") >= rs.getInt("max_attempts"), jobKey, workerId);
    if (exhausted.isEmpty()) {
      return Optional.empty();
    }
    SendStatus target = exhausted.get() ? SendStatus.FAILED : SendStatus.PENDING;
    String sql = "UPDATE " + TABLE + " SET status=" + target.code() +
        ", next_attempt_at=?, last_error=?, locked_by=NULL, locked_at=NULL, updated_at=?, version=version+1" +
        ownedBy;
    int updated = JdbcTemplate.update(conn, sql,
        target == SendStatus.PENDING ? nextAttemptAt : null,
        JdbcTemplate.truncateError(error), now, jobKey, workerId);
    return updated == 1 ? Optional.of(target) : Optional.empty();
  }

  @Override
  public boolean markSkipped(Connection conn, String jobKey, String workerId, String reason, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + SendStatus.SKIPPED.code() +
        ", skipped_at=?, last_error=?, next_attempt_at=NULL, locked_by=NULL, locked_at=NULL" +
        ", updated_at=?, version=version+1" +
        " WHERE job_key=? AND locked_by=? AND status IN " + LOCKED_STATUS_IN;
    return JdbcTemplate.update(conn, sql, now, JdbcTemplate.truncateError(reason), now, jobKey, workerId) == 1;
  }

  @Override
  public int recoverExpiredLocks(Connection conn, Instant lockExpiry, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + SendStatus.PENDING.code() +
        ", locked_by=NULL, locked_at=NULL, next_attempt_at=?, updated_at=?, version=version+1" +
        " WHERE status=" + SendStatus.PROCESSING.code() + " AND locked_at < ?";
    return JdbcTemplate.update(conn, sql, now, now, lockExpiry);
  }

  @Override
  public List<String> findClaimable(Connection conn, Instant now, Instant lockExpiry, int limit) {
    String sql = "SELECT job_key FROM " + TABLE +
        " WHERE (status=" + SendStatus.PENDING.code() + " AND (next_attempt_at IS NULL OR next_attempt_at <= ?))" +
        " OR (status IN " + LOCKED_STATUS_IN + " AND locked_at < ?)" +
        " OR (status=" + SendStatus.FAILED.code() + " AND attempts < max_attempts)" +
        " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString("job_key"), now, lockExpiry, limit);
  }

  @Override
  public Optional<SendEntry> find(Connection conn, String jobKey) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE job_key=?",
        ENTRY_ROW_MAPPER, jobKey);
  }

  @Override
  public Map<SendStatus, Long> countByStatus(Connection conn, String campaignId) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM " + TABLE + " WHERE campaign_id=? GROUP BY status";
    Map<SendStatus, Long> counts = new EnumMap<>(SendStatus.class);
    JdbcTemplate.query(conn, sql, rs -> counts.put(SendStatus.fromCode(rs.getInt("status")), rs.getLong("cnt")),
        campaignId);
    return counts;
  }

  @Override
  public List<SendEntry> findFailed(Connection conn, String campaignId, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE campaign_id=? AND status=" + SendStatus.FAILED.code() + " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, ENTRY_ROW_MAPPER, campaignId, limit);
  }

  @Override
  public int resetFailed(Connection conn, String jobKey, Instant now) {
    return JdbcTemplate.update(conn, resetSql("job_key"), now, now, jobKey);
  }

  @Override
  public int resetAllFailed(Connection conn, String campaignId, Instant now) {
    return JdbcTemplate.update(conn, resetSql("campaign_id"), now, now, campaignId);
  }

  private static String resetSql(String keyColumn) {
    return "UPDATE " + TABLE + " SET status=" + SendStatus.PENDING.code() +
        ", attempts=0, next_attempt_at=?, locked_by=NULL, locked_at=NULL, updated_at=?, version=version+1" +
        " WHERE " + keyColumn + "=? AND status=" + SendStatus.FAILED.code();
  }
}
