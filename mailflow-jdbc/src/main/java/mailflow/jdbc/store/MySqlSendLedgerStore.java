package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.SendEntry;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL send ledger store. Also compatible with TiDB.
 *
 * <p>Registers with {@code INSERT IGNORE}. Besides duplicate keys, MySQL downgrades some other
 * row errors to warnings under {@code IGNORE}; those rows also report as not inserted. Bulk
 * registration sends one JDBC batch; with {@code rewriteBatchedStatements=true} the driver drops
 * per-row counts and the ledger falls back to one insert per row.
 */
public final class MySqlSendLedgerStore extends AbstractJdbcSendLedgerStore {
  private static final String INSERT_SQL = "INSERT IGNORE INTO " + TABLE + INSERT_VALUES;

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, SendEntry entry) {
    return JdbcTemplate.update(conn, INSERT_SQL, insertParams(entry)) == 1;
  }

  @Override
  public List<Boolean> insertAllIfAbsent(Connection conn, List<SendEntry> entries) {
    return batchInsert(conn, INSERT_SQL, entries);
  }
}
