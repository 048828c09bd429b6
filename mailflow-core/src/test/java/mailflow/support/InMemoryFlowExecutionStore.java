package mailflow.support;

import mailflow.model.ExecutionStatus;
import mailflow.model.FlowExecution;
import mailflow.model.StepResult;
import mailflow.spi.FlowExecutionStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Map-backed {@link FlowExecutionStore}. Not transactional: a test that needs rollback
 * semantics belongs in the JDBC module.
 */
public class InMemoryFlowExecutionStore implements FlowExecutionStore {
  private final Map<String, FlowExecution> executions = new LinkedHashMap<>();
  private final Map<String, Map<Integer, StepResult>> results = new LinkedHashMap<>();

  @Override
  public synchronized void insert(Connection conn, FlowExecution execution) {
    if (executions.putIfAbsent(execution.executionId(), execution) != null) {
      throw new IllegalStateException("Duplicate execution " + execution.executionId());
    }
  }

  @Override
  public synchronized Optional<FlowExecution> find(Connection conn, String executionId) {
    FlowExecution e = executions.get(executionId);
    if (e == null) {
      return Optional.empty();
    }
    SortedSet<Integer> completed = new TreeSet<>(results.getOrDefault(executionId, Map.of()).keySet());
    return Optional.of(new FlowExecution(e.executionId(), e.flowId(), e.customerId(), e.status(),
        e.currentStep(), completed, e.context(), e.lastError(), e.resumeAt(), e.version(), e.createdAt(),
        e.updatedAt(), e.finishedAt()));
  }

  @Override
  public synchronized boolean hasOpenExecution(Connection conn, String flowId, String customerId) {
    return executions.values().stream().anyMatch(e -> e.flowId().equals(flowId)
        && e.customerId().equals(customerId) && !e.status().isTerminal());
  }

  @Override
  public synchronized boolean update(Connection conn, FlowExecution execution, long expectedVersion) {
    FlowExecution current = executions.get(execution.executionId());
    if (current == null || current.version() != expectedVersion) {
      return false;
    }
    executions.put(execution.executionId(), new FlowExecution(current.executionId(), current.flowId(),
        current.customerId(), execution.status(), execution.currentStep(), new TreeSet<>(), execution.context(),
        execution.lastError(), execution.resumeAt(), expectedVersion + 1, current.createdAt(),
        execution.updatedAt(), execution.finishedAt()));
    return true;
  }

  @Override
  public synchronized boolean insertStepResult(Connection conn, StepResult result) {
    return results.computeIfAbsent(result.executionId(), k -> new LinkedHashMap<>())
        .putIfAbsent(result.stepIndex(), result) == null;
  }

  @Override
  public synchronized List<StepResult> stepResults(Connection conn, String executionId) {
    return results.getOrDefault(executionId, Map.of()).values().stream()
        .sorted(Comparator.comparingInt(StepResult::stepIndex))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized boolean recordError(Connection conn, String executionId, String error, Instant now) {
    FlowExecution e = executions.get(executionId);
    if (e == null) {
      return false;
    }
    executions.put(executionId, with(e, e.status(), error, now, e.finishedAt()));
    return true;
  }

  @Override
  public synchronized boolean markFailed(Connection conn, String executionId, String error, Instant now) {
    FlowExecution e = executions.get(executionId);
    if (e == null || e.status().isTerminal()) {
      return false;
    }
    executions.put(executionId, with(e, ExecutionStatus.FAILED, error, now, now));
    return true;
  }

  @Override
  public synchronized boolean cancel(Connection conn, String executionId, Instant now) {
    FlowExecution e = executions.get(executionId);
    if (e == null || e.status().isTerminal()) {
      return false;
    }
    executions.put(executionId, with(e, ExecutionStatus.CANCELLED, e.lastError(), now, now));
    return true;
  }

  @Override
  public synchronized List<FlowExecution> findByFlow(Connection conn, String flowId, ExecutionStatus status,
      int limit) {
    List<FlowExecution> matches = new ArrayList<>();
    for (FlowExecution e : executions.values()) {
      if (e.flowId().equals(flowId) && (status == null || e.status() == status) && matches.size() < limit) {
        matches.add(find(conn, e.executionId()).orElseThrow());
      }
    }
    return matches;
  }

  private static FlowExecution with(FlowExecution e, ExecutionStatus status, String error, Instant now,
      Instant finishedAt) {
    return new FlowExecution(e.executionId(), e.flowId(), e.customerId(), status, e.currentStep(),
        e.completedSteps(), e.context(), error, e.resumeAt(), e.version() + 1, e.createdAt(), now, finishedAt);
  }
}
