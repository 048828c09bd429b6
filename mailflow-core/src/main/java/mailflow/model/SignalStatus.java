package mailflow.model;

public enum SignalStatus {
  NEW(0),
  DONE(1),
  RETRY(2),
  DEAD(3);

  private final int code;

  SignalStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
