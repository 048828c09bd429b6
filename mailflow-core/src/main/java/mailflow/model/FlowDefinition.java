package mailflow.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Marketer-authored flow: a trigger and an ordered list of steps. Read-only to the engine,
 * apart from its {@link FlowMetrics} counters.
 */
public record FlowDefinition(
    String flowId,
    String name,
    FlowStatus status,
    Trigger trigger,
    List<Step> steps,
    FlowMetrics metrics,
    Instant createdAt,
    Instant updatedAt
) {

  public FlowDefinition {
    Objects.requireNonNull(flowId, "flowId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(trigger, "trigger");
    steps = List.copyOf(steps);
    metrics = metrics == null ? FlowMetrics.EMPTY : metrics;
  }

  public static FlowDefinition active(String flowId, String name, Trigger trigger, List<Step> steps) {
    Instant now = Instant.now();
    return new FlowDefinition(flowId, name, FlowStatus.ACTIVE, trigger, steps, FlowMetrics.EMPTY, now, now);
  }

  public boolean hasStep(int index) {
    return index >= 0 && index < steps.size();
  }
}
