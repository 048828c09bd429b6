package mailflow.model;

/**
 * Delivery state of one send ledger entry. Persisted as {@link #code()}.
 */
public enum SendStatus {
  PENDING(0),
  PROCESSING(1),
  SENDING(2),
  SENT(3),
  DELIVERED(4),
  FAILED(5),
  BOUNCED(6),
  SKIPPED(7);

  private final int code;

  SendStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Statuses in which the row carries a lock owner. */
  public boolean isLocked() {
    return this == PROCESSING || this == SENDING;
  }

  public boolean isTerminal() {
    return this == SENT || this == DELIVERED || this == FAILED
        || this == BOUNCED || this == SKIPPED;
  }

  public static SendStatus fromCode(int code) {
    for (SendStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown send status code: " + code);
  }
}
