package mailflow.recovery;

import mailflow.ledger.SendLedger;
import mailflow.spi.MetricsExporter;
import mailflow.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically resets send ledger rows left in {@code PROCESSING} by a worker that died.
 *
 * <p>The reset is itself a conditional update on lock age, so it can run on every instance at
 * once and alongside live claims.
 */
public final class LockRecoverySweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LockRecoverySweeper.class.getName());

  private final SendLedger ledger;
  private final MetricsExporter metrics;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private LockRecoverySweeper(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.intervalSeconds <= 0) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("LockRecoverySweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailflow-lock-sweeper-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one sweep. Errors are logged, never thrown.
   *
   * @return rows reset to {@code PENDING}
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      int recovered = ledger.recoverExpiredLocks();
      if (recovered > 0) {
        metrics.incrementLocksRecovered(recovered);
        logger.log(Level.INFO, "Recovered {0} expired send locks", recovered);
      }
      return recovered;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Lock recovery sweep failed", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  public static final class Builder {
    private SendLedger ledger;
    private MetricsExporter metrics;
    private long intervalSeconds = 60;

    private Builder() {
    }

    public Builder ledger(SendLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Delay between sweeps. Optional. Defaults to 60 seconds. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public LockRecoverySweeper build() {
      return new LockRecoverySweeper(this);
    }
  }
}
