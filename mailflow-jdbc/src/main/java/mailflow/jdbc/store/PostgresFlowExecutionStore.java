package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL flow execution store.
 *
 * <p>A failed statement aborts a PostgreSQL transaction, so duplicate step results are
 * filtered with {@code ON CONFLICT DO NOTHING} instead of caught.
 */
public final class PostgresFlowExecutionStore extends AbstractJdbcFlowExecutionStore {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected int insertResultIfAbsent(Connection conn, Object[] params) {
    return JdbcTemplate.update(conn,
        "INSERT INTO " + RESULT_TABLE + RESULT_VALUES + " ON CONFLICT (execution_id, step_index) DO NOTHING",
        params);
  }
}
