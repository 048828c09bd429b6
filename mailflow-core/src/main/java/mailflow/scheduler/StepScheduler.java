package mailflow.scheduler;

import mailflow.QueueStatus;
import mailflow.dispatch.ExponentialBackoffRetryPolicy;
import mailflow.dispatch.RetryPolicy;
import mailflow.model.StepSignal;
import mailflow.spi.ConnectionProvider;
import mailflow.spi.MetricsExporter;
import mailflow.spi.StepSignalStore;
import mailflow.util.DaemonThreadFactory;
import mailflow.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Database-backed, at-least-once delayed queue of step signals.
 *
 * <p>A signal becomes due at its {@code available_at}. A single scheduling thread claims due
 * signals with an owner lock and hands them to a bounded worker pool. A crashed instance's
 * claims expire after the lock timeout and are picked up elsewhere, so a signal may be
 * delivered more than once; the {@link StepHandler} must tolerate that.
 *
 * <p>Outcomes per delivery: success acknowledges the signal; {@link InvalidSignalException}
 * dead-letters it; any other exception retries with exponential backoff until
 * {@code maxAttempts} deliveries failed, then dead-letters it.
 *
 * <p>A waiting step holds no thread: it is only a row with a future {@code available_at}.
 */
public final class StepScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StepScheduler.class.getName());

  private static final String QUEUE_NAME = "flow-steps";

  private final ConnectionProvider connectionProvider;
  private final StepSignalStore store;
  private final StepHandler handler;
  private final Clock clock;
  private final String ownerId;
  private final Duration lockTimeout;
  private final long intervalMs;
  private final int batchSize;
  private final int workerCount;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;

  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicBoolean paused = new AtomicBoolean(false);
  private ScheduledExecutorService pollScheduler;
  private ExecutorService workers;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private StepScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.ownerId = builder.ownerId != null
        ? builder.ownerId : "steps-" + UUID.randomUUID().toString().substring(0, 8);
    this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be positive");
    }
    if (builder.intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.intervalMs = builder.intervalMs;
    this.batchSize = builder.batchSize;
    this.workerCount = builder.workerCount;
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Schedules processing of one step. Fire-and-forget; also the way to resume a waiting
   * execution by hand.
   *
   * @param delay how long to hold the signal back, or {@code null} for immediately
   * @return the new signal's id
   */
  public String enqueueFlowStep(String flowId, String executionId, int stepIndex, Duration delay) {
    StepSignal signal = newSignal(flowId, executionId, stepIndex, delay);
    Transactions.withConnection(connectionProvider, "enqueue step " + stepIndex + " of " + executionId,
        conn -> {
          store.insert(conn, signal);
          return null;
        });
    return signal.signalId();
  }

  private StepSignal newSignal(String flowId, String executionId, int stepIndex, Duration delay) {
    Instant now = now();
    Instant availableAt = delay == null || delay.isNegative() ? now : now.plus(delay);
    return StepSignal.create(flowId, executionId, stepIndex, availableAt, now);
  }

  /**
   * Starts the scheduling thread and the worker pool. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("StepScheduler has been closed");
    }
    if (pollTask != null) {
      return;
    }
    workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("mailflow-step-"));
    pollScheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mailflow-step-poller-"));
    pollTask = pollScheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Claims due signals up to the free worker capacity and submits them to the pool.
   *
   * @return number of signals claimed
   */
  public int poll() {
    if (closed || paused.get() || workers == null) {
      return 0;
    }
    try {
      int capacity = Math.min(batchSize, workerCount - inFlight.get());
      if (capacity <= 0) {
        return 0;
      }
      List<StepSignal> claimed = claim(capacity);
      for (StepSignal signal : claimed) {
        inFlight.incrementAndGet();
        try {
          workers.execute(() -> {
            try {
              process(signal);
            } finally {
              inFlight.decrementAndGet();
            }
          });
        } catch (RejectedExecutionException e) {
          // Shutting down; the claim expires and another instance takes over
          inFlight.decrementAndGet();
        }
      }
      return claimed.size();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Step poll cycle failed", t);
      return 0;
    }
  }

  /**
   * Processes every due signal on the calling thread until none is left, including signals
   * enqueued by the processed steps themselves when they are already due.
   *
   * @return number of deliveries made
   */
  public int drainDue() {
    int delivered = 0;
    List<StepSignal> batch;
    do {
      batch = claim(batchSize);
      for (StepSignal signal : batch) {
        process(signal);
        delivered++;
      }
    } while (!batch.isEmpty());
    return delivered;
  }

  private List<StepSignal> claim(int limit) {
    Instant now = now();
    List<StepSignal> claimed = Transactions.inTransaction(connectionProvider, "claim step signals",
        conn -> store.claimDue(conn, ownerId, now, now.minus(lockTimeout), limit));
    if (claimed.isEmpty()) {
      metrics.recordStepLagMs(0);
    } else {
      Instant oldest = claimed.get(0).availableAt();
      metrics.recordStepLagMs(Math.max(0L, Duration.between(oldest, now).toMillis()));
    }
    return claimed;
  }

  private void process(StepSignal signal) {
    int attempt = signal.attempts() + 1;
    boolean lastAttempt = attempt >= maxAttempts;
    try {
      handler.handle(signal, lastAttempt);
      markDone(signal);
      metrics.incrementStepProcessed();
    } catch (InvalidSignalException e) {
      markDead(signal, e);
      metrics.incrementStepDead();
      logger.log(Level.SEVERE, "Malformed step signal dead-lettered: " + signal.signalId(), e);
    } catch (Exception e) {
      if (lastAttempt) {
        markDead(signal, e);
        metrics.incrementStepDead();
        logger.log(Level.SEVERE, "Step signal moved to DEAD after " + attempt + " attempts: "
            + signal.signalId(), e);
      } else {
        Instant nextAt = now().plusMillis(retryPolicy.computeDelayMs(attempt));
        markRetry(signal, nextAt, e);
        metrics.incrementStepRetried();
        logger.log(Level.WARNING, "Step signal " + signal.signalId() + " failed on attempt " + attempt
            + ", retrying at " + nextAt, e);
      }
    }
  }

  private void markDone(StepSignal signal) {
    withConnection("mark DONE", signal, conn -> store.markDone(conn, signal.signalId(), now()));
  }

  private void markRetry(StepSignal signal, Instant nextAt, Exception failure) {
    withConnection("mark RETRY", signal,
        conn -> store.markRetry(conn, signal.signalId(), nextAt, messageOf(failure)));
  }

  private void markDead(StepSignal signal, Exception failure) {
    withConnection("mark DEAD", signal, conn -> store.markDead(conn, signal.signalId(), messageOf(failure)));
  }

  private void withConnection(String action, StepSignal signal, Transactions.SqlWork<Integer> work) {
    try {
      Transactions.withConnection(connectionProvider, action, work);
    } catch (RuntimeException e) {
      // The claim expires and the signal is delivered again
      logger.log(Level.SEVERE, "Failed to " + action + " for signalId=" + signal.signalId(), e);
    }
  }

  /** Stops claiming new signals until {@link #resume()}. Running steps finish. */
  public void pause() {
    paused.set(true);
  }

  public void resume() {
    paused.set(false);
  }

  /**
   * @return a live snapshot, or {@link QueueStatus#unavailable} before {@link #start()} and
   *     after {@link #close()}
   */
  public QueueStatus status() {
    if (closed || pollTask == null) {
      return QueueStatus.unavailable(QUEUE_NAME);
    }
    int pending;
    try {
      pending = Transactions.withConnection(connectionProvider, "count pending signals", store::countPending);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to count pending step signals", e);
      pending = -1;
    }
    return new QueueStatus(QUEUE_NAME, true, paused.get(), pending, inFlight.get(), workerCount);
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static String messageOf(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (pollScheduler != null) {
      pollScheduler.shutdownNow();
    }
    if (workers != null) {
      workers.shutdown();
      try {
        if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.warning("Step workers did not finish in time; forcing shutdown");
          workers.shutdownNow();
        }
      } catch (InterruptedException e) {
        workers.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link StepScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private StepSignalStore store;
    private StepHandler handler;
    private Clock clock;
    private String ownerId;
    private Duration lockTimeout = Duration.ofMinutes(5);
    private long intervalMs = 1000;
    private int batchSize = 50;
    private int workerCount = 5;
    private int maxAttempts = 3;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(StepSignalStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder handler(StepHandler handler) {
      this.handler = handler;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Lock owner id written to claimed signals (e.g. hostname or pod name).
     *
     * <p>Optional. Defaults to a random {@code steps-xxxxxxxx}.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * How long a claimed signal stays locked before another instance may take it.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /** Optional. Defaults to {@code 1000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Concurrent step executions. Optional. Defaults to {@code 5}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Deliveries per signal before it goes DEAD. Optional. Defaults to {@code 3}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 2 second base.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public StepScheduler build() {
      return new StepScheduler(this);
    }
  }
}
