package mailflow.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;

import javax.sql.DataSource;

class H2StoresIntegrationTest extends AbstractJdbcStoresIntegrationTest {
  private static JdbcDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = Schemas.h2("stores");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  String databaseName() {
    return "h2";
  }
}
