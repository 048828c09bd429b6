package mailflow.model;

/**
 * Aggregate counters kept on a flow definition.
 */
public record FlowMetrics(long triggered, long currentlyActive, long completed, long emailsSent) {

  public static final FlowMetrics EMPTY = new FlowMetrics(0, 0, 0, 0);
}
