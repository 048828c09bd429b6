package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.SendEntry;

import java.sql.Connection;
import java.util.List;

/**
 * H2 send ledger store. Primarily for testing.
 *
 * <p>Inserts plainly and treats a unique-constraint violation as "already registered". H2 keeps
 * the transaction usable after such an error, but a duplicate would abort a JDBC batch, so
 * bulk registration inserts row by row.
 */
public final class H2SendLedgerStore extends AbstractJdbcSendLedgerStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, SendEntry entry) {
    return JdbcTemplate.insertUnlessDuplicate(conn, "INSERT INTO " + TABLE + INSERT_VALUES,
        insertParams(entry)) == 1;
  }
}
