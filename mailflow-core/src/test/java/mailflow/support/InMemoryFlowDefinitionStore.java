package mailflow.support;

import mailflow.model.FlowDefinition;
import mailflow.model.FlowMetrics;
import mailflow.model.FlowStatus;
import mailflow.model.TriggerType;
import mailflow.spi.FlowDefinitionStore;

import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryFlowDefinitionStore implements FlowDefinitionStore {
  private final Map<String, FlowDefinition> flows = new LinkedHashMap<>();

  @Override
  public synchronized void save(Connection conn, FlowDefinition flow) {
    FlowDefinition existing = flows.get(flow.flowId());
    FlowMetrics metrics = existing != null ? existing.metrics() : flow.metrics();
    flows.put(flow.flowId(), new FlowDefinition(flow.flowId(), flow.name(), flow.status(), flow.trigger(),
        flow.steps(), metrics, flow.createdAt(), flow.updatedAt()));
  }

  @Override
  public synchronized Optional<FlowDefinition> find(Connection conn, String flowId) {
    return Optional.ofNullable(flows.get(flowId));
  }

  @Override
  public synchronized List<FlowDefinition> findActiveByTrigger(Connection conn, TriggerType triggerType) {
    return flows.values().stream()
        .filter(f -> f.status() == FlowStatus.ACTIVE && f.trigger().type() == triggerType)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized boolean delete(Connection conn, String flowId) {
    return flows.remove(flowId) != null;
  }

  @Override
  public synchronized void addToMetrics(Connection conn, String flowId, long triggered, long currentlyActive,
      long completed, long emailsSent) {
    FlowDefinition f = flows.get(flowId);
    if (f == null) {
      return;
    }
    FlowMetrics m = f.metrics();
    FlowMetrics updated = new FlowMetrics(m.triggered() + triggered, m.currentlyActive() + currentlyActive,
        m.completed() + completed, m.emailsSent() + emailsSent);
    flows.put(flowId, new FlowDefinition(f.flowId(), f.name(), f.status(), f.trigger(), f.steps(), updated,
        f.createdAt(), f.updatedAt()));
  }

  public synchronized FlowMetrics metrics(String flowId) {
    return flows.get(flowId).metrics();
  }
}
