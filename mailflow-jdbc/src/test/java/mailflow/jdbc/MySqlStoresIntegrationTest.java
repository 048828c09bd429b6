package mailflow.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlStoresIntegrationTest extends AbstractJdbcStoresIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("mailflow_test");

  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    Schemas.create(dataSource, "/schema/mysql.sql");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  String databaseName() {
    return "mysql";
  }
}
