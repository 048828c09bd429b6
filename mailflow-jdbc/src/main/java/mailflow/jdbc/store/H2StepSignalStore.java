package mailflow.jdbc.store;

import java.util.List;

/**
 * H2 step signal queue. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcStepSignalStore}.
 */
public final class H2StepSignalStore extends AbstractJdbcStepSignalStore {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
