package mailflow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the ledger, the scheduler and the flow engine.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see mailflow.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
