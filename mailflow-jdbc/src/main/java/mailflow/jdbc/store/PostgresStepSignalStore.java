package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.StepSignal;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL step signal queue.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip claim,
 * so concurrent schedulers never block on each other's rows.
 */
public final class PostgresStepSignalStore extends AbstractJdbcStepSignalStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<StepSignal> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + TABLE + " SET locked_by=?, locked_at=? WHERE signal_id IN (" +
        "SELECT signal_id FROM " + TABLE + " WHERE " + DUE +
        " ORDER BY available_at, created_at LIMIT ? FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<StepSignal> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, SIGNAL_ROW_MAPPER,
        ownerId, nowMs, now, lockExpiry, limit));
    // RETURNING does not preserve the subquery order
    claimed.sort(Comparator.comparing(StepSignal::availableAt).thenComparing(StepSignal::createdAt));
    return claimed;
  }
}
