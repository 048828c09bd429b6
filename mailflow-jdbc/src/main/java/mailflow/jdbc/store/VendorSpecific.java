package mailflow.jdbc.store;

import java.util.List;

/**
 * A store variant written for one database family. {@link JdbcStores} picks variants by
 * {@link #name()} or by matching a JDBC URL against {@link #jdbcUrlPrefixes()}.
 */
public interface VendorSpecific {

  /**
   * Unique identifier of the database family (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this variant handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();
}
