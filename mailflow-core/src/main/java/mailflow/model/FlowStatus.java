package mailflow.model;

public enum FlowStatus {
  DRAFT,
  ACTIVE,
  PAUSED
}
