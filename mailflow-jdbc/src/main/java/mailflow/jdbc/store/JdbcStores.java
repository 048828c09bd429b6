package mailflow.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The four JDBC stores for one database family, with auto-detection support.
 *
 * <p>Vendor-specific stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/mailflow.jdbc.store.AbstractJdbcSendLedgerStore},
 * {@code ...AbstractJdbcStepSignalStore} and {@code ...AbstractJdbcFlowExecutionStore}.
 * The flow definition store is portable and shared by every family.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * JdbcStores stores = JdbcStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * JdbcStores stores = JdbcStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Get by name
 * JdbcStores stores = JdbcStores.get("postgresql");
 * }</pre>
 */
public final class JdbcStores {

  private static final Map<String, AbstractJdbcSendLedgerStore> LEDGER_STORES =
      load(AbstractJdbcSendLedgerStore.class);
  private static final Map<String, AbstractJdbcStepSignalStore> SIGNAL_STORES =
      load(AbstractJdbcStepSignalStore.class);
  private static final Map<String, AbstractJdbcFlowExecutionStore> EXECUTION_STORES =
      load(AbstractJdbcFlowExecutionStore.class);

  private final String name;
  private final AbstractJdbcSendLedgerStore sendLedgerStore;
  private final AbstractJdbcStepSignalStore stepSignalStore;
  private final AbstractJdbcFlowExecutionStore flowExecutionStore;
  private final JdbcFlowDefinitionStore flowDefinitionStore;

  private JdbcStores(String name, AbstractJdbcSendLedgerStore sendLedgerStore,
      AbstractJdbcStepSignalStore stepSignalStore, AbstractJdbcFlowExecutionStore flowExecutionStore,
      JdbcFlowDefinitionStore flowDefinitionStore) {
    this.name = name;
    this.sendLedgerStore = sendLedgerStore;
    this.stepSignalStore = stepSignalStore;
    this.flowExecutionStore = flowExecutionStore;
    this.flowDefinitionStore = flowDefinitionStore;
  }

  /**
   * Database families for which all three vendor-specific stores are registered.
   */
  public static Set<String> names() {
    Set<String> names = new LinkedHashSet<>(LEDGER_STORES.keySet());
    names.retainAll(SIGNAL_STORES.keySet());
    names.retainAll(EXECUTION_STORES.keySet());
    return names;
  }

  /**
   * Gets the stores of a database family by name.
   *
   * @param name family name (case-insensitive)
   * @throws IllegalArgumentException if any of the stores is missing for that name
   */
  public static JdbcStores get(String name) {
    Objects.requireNonNull(name, "name");
    String key = name.toLowerCase();
    AbstractJdbcSendLedgerStore ledger = LEDGER_STORES.get(key);
    AbstractJdbcStepSignalStore signals = SIGNAL_STORES.get(key);
    AbstractJdbcFlowExecutionStore executions = EXECUTION_STORES.get(key);
    if (ledger == null || signals == null || executions == null) {
      throw new IllegalArgumentException("Unknown database: " + name + ". Available: " + names());
    }
    return new JdbcStores(key, ledger, signals, executions, new JdbcFlowDefinitionStore());
  }

  /**
   * Auto-detects the stores from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if no family matches the JDBC URL
   */
  public static JdbcStores detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect database from DataSource", e);
    }
  }

  /**
   * Auto-detects the stores from a JDBC URL.
   *
   * @throws IllegalArgumentException if no family matches the JDBC URL
   */
  public static JdbcStores detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase();
    for (AbstractJdbcSendLedgerStore store : LEDGER_STORES.values()) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase())) {
          return get(store.name());
        }
      }
    }
    throw new IllegalArgumentException("No database found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + LEDGER_STORES.values().stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream()).toList());
  }

  public String name() {
    return name;
  }

  public AbstractJdbcSendLedgerStore sendLedgerStore() {
    return sendLedgerStore;
  }

  public AbstractJdbcStepSignalStore stepSignalStore() {
    return stepSignalStore;
  }

  public AbstractJdbcFlowExecutionStore flowExecutionStore() {
    return flowExecutionStore;
  }

  public JdbcFlowDefinitionStore flowDefinitionStore() {
    return flowDefinitionStore;
  }

  private static <T extends VendorSpecific> Map<String, T> load(Class<T> type) {
    return ServiceLoader.load(type).stream()
        .map(ServiceLoader.Provider::get)
        .collect(Collectors.toMap(s -> s.name().toLowerCase(), Function.identity(), (a, b) -> a,
            LinkedHashMap::new));
  }
}
