package mailflow.model;

public enum ExecutionStatus {
  ACTIVE(0),
  WAITING(1),
  COMPLETED(2),
  CANCELLED(3),
  FAILED(4);

  private final int code;

  ExecutionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }

  public static ExecutionStatus fromCode(int code) {
    for (ExecutionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown execution status code: " + code);
  }
}
