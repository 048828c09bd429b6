package mailflow.spi;

import mailflow.model.FlowDefinition;
import mailflow.model.TriggerType;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for flow definitions and their aggregate counters.
 */
public interface FlowDefinitionStore {

  /** Inserts the definition, or replaces name, status, trigger and steps of an existing one. */
  void save(Connection conn, FlowDefinition flow);

  Optional<FlowDefinition> find(Connection conn, String flowId);

  List<FlowDefinition> findActiveByTrigger(Connection conn, TriggerType triggerType);

  boolean delete(Connection conn, String flowId);

  /**
   * Adds the given deltas to the flow's counters in one statement.
   */
  void addToMetrics(Connection conn, String flowId, long triggered, long currentlyActive,
      long completed, long emailsSent);
}
