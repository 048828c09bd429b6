package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.SignalStatus;
import mailflow.model.StepSignal;
import mailflow.spi.StepSignalStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC step signal queue with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim strategies.
 * Register custom implementations via
 * {@code META-INF/services/mailflow.jdbc.store.AbstractJdbcStepSignalStore}.
 *
 * @see JdbcStores
 */
public abstract class AbstractJdbcStepSignalStore implements StepSignalStore, VendorSpecific {
  protected static final String TABLE = "step_signal";

  protected static final String PENDING_STATUS_IN =
      "(" + SignalStatus.NEW.code() + "," + SignalStatus.RETRY.code() + ")";

  protected static final String COLUMNS =
      "signal_id, flow_id, execution_id, step_index, attempts, available_at, created_at";

  /** Parameters: now, lock expiry. */
  protected static final String DUE = "status IN " + PENDING_STATUS_IN + " AND available_at <= ?" +
      " AND (locked_by IS NULL OR locked_at < ?)";

  protected static final JdbcTemplate.RowMapper<StepSignal> SIGNAL_ROW_MAPPER = rs -> new StepSignal(
      rs.getString("signal_id"),
      rs.getString("flow_id"),
      rs.getString("execution_id"),
      JdbcTemplate.nullableInt(rs, "step_index"),
      rs.getInt("attempts"),
      JdbcTemplate.instant(rs, "available_at"),
      JdbcTemplate.instant(rs, "created_at"));

  @Override
  public void insert(Connection conn, StepSignal signal) {
    String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ", status, last_error, locked_by, locked_at, done_at)" +
        " VALUES (?,?,?,?,?,?,?,?,NULL,NULL,NULL,NULL)";
    JdbcTemplate.update(conn, sql, signal.signalId(), signal.flowId(), signal.executionId(),
        signal.stepIndex(), signal.attempts(), signal.availableAt(), signal.createdAt(),
        SignalStatus.NEW.code());
  }

  @Override
  public List<StepSignal> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // Phase 1: UPDATE with subquery (H2-compatible default)
    String claimSql = "UPDATE " + TABLE + " SET locked_by=?, locked_at=? WHERE signal_id IN (" +
        "SELECT signal_id FROM " + TABLE + " WHERE " + DUE + " ORDER BY available_at, created_at LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    // Phase 2: SELECT rows claimed in this cycle
    return selectClaimed(conn, ownerId, nowMs);
  }

  /**
   * Selects rows claimed by the given owner at the given lock timestamp.
   * Shared by subclasses that use a two-phase claim (UPDATE then SELECT).
   */
  protected List<StepSignal> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE locked_by=? AND locked_at=? AND status IN " + PENDING_STATUS_IN +
        " ORDER BY available_at, created_at";
    return JdbcTemplate.query(conn, sql, SIGNAL_ROW_MAPPER, ownerId, lockedAt);
  }

  @Override
  public int markDone(Connection conn, String signalId, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + SignalStatus.DONE.code() +
        ", done_at=?, locked_by=NULL, locked_at=NULL" +
        " WHERE signal_id=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, now, signalId);
  }

  @Override
  public int markRetry(Connection conn, String signalId, Instant nextAt, String error) {
    String sql = "UPDATE " + TABLE + " SET status=" + SignalStatus.RETRY.code() +
        ", attempts=attempts+1, available_at=?, last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE signal_id=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, nextAt, JdbcTemplate.truncateError(error), signalId);
  }

  @Override
  public int markDead(Connection conn, String signalId, String error) {
    String sql = "UPDATE " + TABLE + " SET status=" + SignalStatus.DEAD.code() +
        ", last_error=?, locked_by=NULL, locked_at=NULL" +
        " WHERE signal_id=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.truncateError(error), signalId);
  }

  @Override
  public List<StepSignal> findPending(Connection conn, String executionId) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE execution_id=? AND status IN " + PENDING_STATUS_IN + " ORDER BY available_at, created_at";
    return JdbcTemplate.query(conn, sql, SIGNAL_ROW_MAPPER, executionId);
  }

  @Override
  public int countPending(Connection conn) {
    String sql = "SELECT COUNT(*) AS cnt FROM " + TABLE + " WHERE status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getInt("cnt")).orElse(0);
  }
}
