package mailflow.model;

import java.time.Instant;

/**
 * Log entry for one completed step. At most one exists per (execution, step index).
 */
public record StepResult(String executionId, int stepIndex, StepType stepType,
    StepOutcome outcome, String detail, Instant completedAt) {
}
