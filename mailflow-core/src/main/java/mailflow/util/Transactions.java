package mailflow.util;

import mailflow.spi.ConnectionProvider;
import mailflow.spi.StoreException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs store calls on a fresh connection, either in auto-commit mode or inside one transaction.
 * {@link SQLException}s surface as {@link StoreException}.
 */
public final class Transactions {

  @FunctionalInterface
  public interface SqlWork<T> {
    T run(Connection conn) throws SQLException;
  }

  private Transactions() {
  }

  /** Auto-commit: every statement stands alone. */
  public static <T> T withConnection(ConnectionProvider connectionProvider, String action, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return work.run(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  /** All statements commit together or not at all. */
  public static <T> T inTransaction(ConnectionProvider connectionProvider, String action, SqlWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.run(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
