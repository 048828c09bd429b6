package mailflow.dispatch;

import mailflow.ledger.SendLedger;
import mailflow.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled ledger scanner that feeds claimable job keys to the dispatcher's cold queue.
 *
 * <p>Finds rows that were never submitted hot, rows whose retry backoff has elapsed and rows
 * whose lock expired. The poller itself takes no locks; the dispatcher's claim does.
 *
 * <p>The {@link #start()} and {@link #close()} methods are synchronized to prevent concurrent
 * lifecycle transitions.
 */
public final class SendPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SendPoller.class.getName());

  private final SendLedger ledger;
  private final SendDispatcher dispatcher;
  private final int batchSize;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private SendPoller(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SendPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailflow-send-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single poll cycle.
   *
   * @return number of job keys handed to the dispatcher
   */
  public int poll() {
    if (closed || dispatcher.isPaused()) {
      return 0;
    }
    try {
      int capacity = Math.min(batchSize, dispatcher.coldQueueRemainingCapacity());
      if (capacity <= 0) {
        return 0;
      }
      List<String> keys = ledger.findClaimable(capacity);
      int handed = 0;
      for (String key : keys) {
        if (!dispatcher.submitCold(key)) {
          break; // cold queue full
        }
        handed++;
      }
      return handed;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Send poll cycle failed", t);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
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

  /** Builder for {@link SendPoller}. */
  public static final class Builder {
    private SendLedger ledger;
    private SendDispatcher dispatcher;
    private int batchSize = 100;
    private long intervalMs = 5000;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder ledger(SendLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /** <b>Required.</b> */
    public Builder dispatcher(SendDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /** Maximum job keys fetched per cycle. Optional. Defaults to {@code 100}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public SendPoller build() {
      return new SendPoller(this);
    }
  }
}
