package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.StepSignal;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * MySQL step signal queue. Also compatible with TiDB.
 *
 * <p>Uses {@code UPDATE...ORDER BY...LIMIT} for claim followed by a {@code SELECT} of the
 * claimed rows. The UPDATE takes row locks until the claiming transaction commits, so two
 * schedulers never end up owning the same signal.
 */
public final class MySqlStepSignalStore extends AbstractJdbcStepSignalStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public List<StepSignal> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // MySQL supports UPDATE...ORDER BY...LIMIT (no subquery needed)
    String claimSql = "UPDATE " + TABLE + " SET locked_by=?, locked_at=? WHERE " + DUE +
        " ORDER BY available_at, created_at LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, ownerId, nowMs);
  }
}
