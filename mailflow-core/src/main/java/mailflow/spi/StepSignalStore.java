package mailflow.spi;

import mailflow.model.StepSignal;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Durable queue of step signals. Signals become visible at {@code available_at} and are handed
 * out with claim locking so several scheduler instances can share one table.
 */
public interface StepSignalStore {

  void insert(Connection conn, StepSignal signal);

  /**
   * Locks up to {@code limit} due {@code NEW}/{@code RETRY} signals whose lock is free or older
   * than {@code lockExpiry}, and returns them oldest first.
   */
  List<StepSignal> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit);

  int markDone(Connection conn, String signalId, Instant now);

  /** Increments attempts and makes the signal visible again at {@code nextAt}. */
  int markRetry(Connection conn, String signalId, Instant nextAt, String error);

  int markDead(Connection conn, String signalId, String error);

  /** Undelivered ({@code NEW}/{@code RETRY}) signals of one execution. */
  List<StepSignal> findPending(Connection conn, String executionId);

  int countPending(Connection conn);
}
