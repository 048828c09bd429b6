package mailflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Durable state of one flow running for one customer.
 *
 * <p>{@code completedSteps} is derived from the execution's step results and only grows.
 * {@code version} guards every state transition.
 */
public record FlowExecution(
    String executionId,
    String flowId,
    String customerId,
    ExecutionStatus status,
    int currentStep,
    SortedSet<Integer> completedSteps,
    ExecutionContext context,
    String lastError,
    Instant resumeAt,
    long version,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {

  public FlowExecution {
    completedSteps = Collections.unmodifiableSortedSet(new TreeSet<>(completedSteps));
    context = context == null ? ExecutionContext.EMPTY : context;
  }

  /**
   * Index of the next step this execution accepts: {@code 0} before any step ran,
   * otherwise one past the highest completed index.
   */
  public int nextExpectedStep() {
    return completedSteps.isEmpty() ? 0 : completedSteps.last() + 1;
  }

  public boolean isCompleted(int stepIndex) {
    return completedSteps.contains(stepIndex);
  }
}
