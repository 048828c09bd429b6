package mailflow.model;

public enum StepType {
  SEND_EMAIL,
  WAIT,
  CONDITION,
  ADD_TAG,
  CREATE_DISCOUNT
}
