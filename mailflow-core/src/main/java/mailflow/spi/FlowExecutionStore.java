package mailflow.spi;

import mailflow.model.ExecutionStatus;
import mailflow.model.FlowExecution;
import mailflow.model.StepResult;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for flow executions and their step results.
 *
 * <p>{@link #update} is guarded by the execution's version; the step result table has one row
 * per (execution, step index), which makes completed steps insert-only.
 */
public interface FlowExecutionStore {

  void insert(Connection conn, FlowExecution execution);

  /** Loads the execution with its completed step indexes. */
  Optional<FlowExecution> find(Connection conn, String executionId);

  /** Whether the customer already has an {@code ACTIVE} or {@code WAITING} run of the flow. */
  boolean hasOpenExecution(Connection conn, String flowId, String customerId);

  /**
   * Writes status, current step, context, error and resume time of {@code execution} if the
   * stored version still equals {@code expectedVersion}; bumps the version.
   *
   * @return {@code false} if another writer got there first
   */
  boolean update(Connection conn, FlowExecution execution, long expectedVersion);

  /**
   * @return {@code false} if a result for the same (execution, step index) already exists
   */
  boolean insertStepResult(Connection conn, StepResult result);

  List<StepResult> stepResults(Connection conn, String executionId);

  /** Records an error without changing status. */
  boolean recordError(Connection conn, String executionId, String error, Instant now);

  /** {@code ACTIVE|WAITING -> FAILED}. */
  boolean markFailed(Connection conn, String executionId, String error, Instant now);

  /** {@code ACTIVE|WAITING -> CANCELLED}. */
  boolean cancel(Connection conn, String executionId, Instant now);

  List<FlowExecution> findByFlow(Connection conn, String flowId, ExecutionStatus status, int limit);
}
