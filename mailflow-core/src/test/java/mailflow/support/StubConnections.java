package mailflow.support;

import mailflow.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection providers for unit tests that run against in-memory stores.
 */
public final class StubConnections {

  private StubConnections() {
  }

  /** Every call on the returned connections is a no-op. */
  public static ConnectionProvider noop() {
    return counting(new AtomicInteger(), new AtomicInteger());
  }

  /**
   * Counts commits and rollbacks across every connection handed out.
   */
  public static ConnectionProvider counting(AtomicInteger commits, AtomicInteger rollbacks) {
    return () -> (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          switch (method.getName()) {
            case "commit":
              commits.incrementAndGet();
              return null;
            case "rollback":
              rollbacks.incrementAndGet();
              return null;
            case "getAutoCommit":
            case "isClosed":
              return false;
            default:
              return null;
          }
        });
  }
}
