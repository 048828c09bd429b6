package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL flow execution store. Also compatible with TiDB.
 */
public final class MySqlFlowExecutionStore extends AbstractJdbcFlowExecutionStore {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected int insertResultIfAbsent(Connection conn, Object[] params) {
    return JdbcTemplate.update(conn, "INSERT IGNORE INTO " + RESULT_TABLE + RESULT_VALUES, params);
  }
}
