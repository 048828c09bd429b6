package mailflow.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;

/**
 * Queued instruction to process one step of one execution.
 *
 * <p>Not authoritative: the payload fields are nullable because a signal may arrive incomplete,
 * late, or more than once. The execution record decides what happens.
 */
public record StepSignal(
    String signalId,
    String flowId,
    String executionId,
    Integer stepIndex,
    int attempts,
    Instant availableAt,
    Instant createdAt
) {

  /** A fresh, never-delivered signal with a random id. */
  public static StepSignal create(String flowId, String executionId, int stepIndex,
      Instant availableAt, Instant now) {
    return new StepSignal(UlidCreator.getMonotonicUlid().toString(), flowId, executionId, stepIndex, 0, availableAt, now);
  }

  public boolean isComplete() {
    return flowId != null && !flowId.isEmpty()
        && executionId != null && !executionId.isEmpty()
        && stepIndex != null && stepIndex >= 0;
  }
}
