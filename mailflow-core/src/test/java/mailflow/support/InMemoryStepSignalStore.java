package mailflow.support;

import mailflow.model.SignalStatus;
import mailflow.model.StepSignal;
import mailflow.spi.StepSignalStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class InMemoryStepSignalStore implements StepSignalStore {
  private final Map<String, Row> rows = new LinkedHashMap<>();

  private static final class Row {
    StepSignal signal;
    SignalStatus status = SignalStatus.NEW;
    String lockedBy;
    Instant lockedAt;
    String lastError;

    Row(StepSignal signal) {
      this.signal = signal;
    }
  }

  @Override
  public synchronized void insert(Connection conn, StepSignal signal) {
    rows.put(signal.signalId(), new Row(signal));
  }

  @Override
  public synchronized List<StepSignal> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry,
      int limit) {
    List<Row> due = rows.values().stream()
        .filter(r -> r.status == SignalStatus.NEW || r.status == SignalStatus.RETRY)
        .filter(r -> !r.signal.availableAt().isAfter(now))
        .filter(r -> r.lockedAt == null || r.lockedAt.isBefore(lockExpiry))
        .sorted(Comparator.comparing((Row r) -> r.signal.availableAt()).thenComparing(r -> r.signal.createdAt()))
        .limit(limit)
        .collect(Collectors.toList());
    List<StepSignal> claimed = new ArrayList<>();
    for (Row r : due) {
      r.lockedBy = ownerId;
      r.lockedAt = now;
      claimed.add(r.signal);
    }
    return claimed;
  }

  @Override
  public synchronized int markDone(Connection conn, String signalId, Instant now) {
    return set(signalId, SignalStatus.DONE, null);
  }

  @Override
  public synchronized int markRetry(Connection conn, String signalId, Instant nextAt, String error) {
    Row r = rows.get(signalId);
    if (r == null) {
      return 0;
    }
    StepSignal s = r.signal;
    r.signal = new StepSignal(s.signalId(), s.flowId(), s.executionId(), s.stepIndex(), s.attempts() + 1,
        nextAt, s.createdAt());
    return set(signalId, SignalStatus.RETRY, error);
  }

  @Override
  public synchronized int markDead(Connection conn, String signalId, String error) {
    return set(signalId, SignalStatus.DEAD, error);
  }

  @Override
  public synchronized List<StepSignal> findPending(Connection conn, String executionId) {
    return rows.values().stream()
        .filter(r -> r.status == SignalStatus.NEW || r.status == SignalStatus.RETRY)
        .filter(r -> executionId.equals(r.signal.executionId()))
        .map(r -> r.signal)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized int countPending(Connection conn) {
    return (int) rows.values().stream()
        .filter(r -> r.status == SignalStatus.NEW || r.status == SignalStatus.RETRY)
        .count();
  }

  public synchronized SignalStatus status(String signalId) {
    return rows.get(signalId).status;
  }

  public synchronized String lastError(String signalId) {
    return rows.get(signalId).lastError;
  }

  public synchronized int attempts(String signalId) {
    return rows.get(signalId).signal.attempts();
  }

  private int set(String signalId, SignalStatus status, String error) {
    Row r = rows.get(signalId);
    if (r == null) {
      return 0;
    }
    r.status = status;
    r.lockedBy = null;
    r.lockedAt = null;
    r.lastError = error;
    return 1;
  }
}
