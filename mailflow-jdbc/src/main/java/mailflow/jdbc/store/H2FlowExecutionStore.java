package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * H2 flow execution store. Primarily for testing.
 *
 * <p>A duplicate step result surfaces as a primary-key violation, which H2 reports without
 * invalidating the transaction.
 */
public final class H2FlowExecutionStore extends AbstractJdbcFlowExecutionStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected int insertResultIfAbsent(Connection conn, Object[] params) {
    return JdbcTemplate.insertUnlessDuplicate(conn, "INSERT INTO " + RESULT_TABLE + RESULT_VALUES, params);
  }
}
