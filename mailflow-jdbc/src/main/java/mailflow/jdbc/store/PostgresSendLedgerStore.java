package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.SendEntry;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL send ledger store.
 *
 * <p>Registers with {@code ON CONFLICT DO NOTHING}, which covers both the job-key primary key
 * and the (campaign, recipient) unique constraint, and claims with {@code UPDATE ... RETURNING}
 * in a single round trip. Bulk registration sends one JDBC batch per chunk of rows.
 */
public final class PostgresSendLedgerStore extends AbstractJdbcSendLedgerStore {
  private static final String INSERT_SQL = "INSERT INTO " + TABLE + INSERT_VALUES + " ON CONFLICT DO NOTHING";

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, SendEntry entry) {
    return JdbcTemplate.update(conn, INSERT_SQL, insertParams(entry)) == 1;
  }

  @Override
  public List<Boolean> insertAllIfAbsent(Connection conn, List<SendEntry> entries) {
    return batchInsert(conn, INSERT_SQL, entries);
  }

  @Override
  public Optional<SendEntry> claim(Connection conn, String jobKey, String workerId, Instant now,
      Instant lockExpiry) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + TABLE + CLAIM_SET + " WHERE job_key=? AND " + CLAIMABLE +
        " RETURNING " + COLUMNS;
    List<SendEntry> claimed = JdbcTemplate.updateReturning(conn, sql, ENTRY_ROW_MAPPER,
        workerId, nowMs, nowMs, nowMs, jobKey, lockExpiry);
    return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
  }
}
