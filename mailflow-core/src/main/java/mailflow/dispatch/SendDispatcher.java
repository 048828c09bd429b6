package mailflow.dispatch;

import mailflow.QueueStatus;
import mailflow.ledger.SendLedger;
import mailflow.model.SendEntry;
import mailflow.model.SendStatus;
import mailflow.spi.CampaignContentProvider;
import mailflow.spi.CampaignCounters;
import mailflow.spi.DeliveryProvider;
import mailflow.spi.DeliveryReceipt;
import mailflow.spi.MessageContent;
import mailflow.spi.MetricsExporter;
import mailflow.spi.SuppressionList;
import mailflow.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size worker pool that claims send ledger rows and hands them to the
 * {@link DeliveryProvider}.
 *
 * <p>Job keys arrive via two paths: the <em>hot queue</em> (submitted right after registration)
 * and the <em>cold queue</em> (fed by {@link SendPoller}). Workers drain both with a weighted
 * 2:1 round-robin favouring the hot queue. Each job key is processed as:
 * <ol>
 *   <li>claim the row; an empty claim means someone else owns it and the key is dropped</li>
 *   <li>skip suppressed recipients ({@code SKIPPED})</li>
 *   <li>mark {@code SENDING}, resolve content, call the provider</li>
 *   <li>{@code SENT} on success; on failure the ledger decides between a retry and
 *       {@code FAILED}</li>
 * </ol>
 * A worker that dies mid-send leaves the row locked; the lock timeout makes it claimable again.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class SendDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SendDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<String> hotQueue;
  private final BlockingQueue<String> coldQueue;
  private final ExecutorService workers;
  private final int workerCount;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean paused = new AtomicBoolean(false);
  private final AtomicInteger pollCounter = new AtomicInteger(0);
  private final AtomicInteger active = new AtomicInteger(0);

  private final SendLedger ledger;
  private final DeliveryProvider deliveryProvider;
  private final CampaignContentProvider contentProvider;
  private final SuppressionList suppressionList;
  private final CampaignCounters campaignCounters;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final String workerId;
  private final long drainTimeoutMs;

  private SendDispatcher(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.deliveryProvider = Objects.requireNonNull(builder.deliveryProvider, "deliveryProvider");
    this.contentProvider = Objects.requireNonNull(builder.contentProvider, "contentProvider");
    this.suppressionList = builder.suppressionList != null ? builder.suppressionList : SuppressionList.NONE;
    this.campaignCounters = builder.campaignCounters != null ? builder.campaignCounters : CampaignCounters.NOOP;
    this.inFlightTracker = builder.inFlightTracker != null ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.workerId = builder.workerId != null
        ? builder.workerId : "dispatcher-" + UUID.randomUUID().toString().substring(0, 8);
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.hotQueueCapacity <= 0 || builder.coldQueueCapacity <= 0) {
      throw new IllegalArgumentException("Queue capacities must be > 0");
    }
    this.workerCount = builder.workerCount;
    this.hotQueue = new ArrayBlockingQueue<>(builder.hotQueueCapacity);
    this.coldQueue = new ArrayBlockingQueue<>(builder.coldQueueCapacity);

    if (workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("mailflow-send-"));
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // workerCount=0: nothing drains the queues (testing only)
      logger.warning("workerCount=0: no send workers started; job keys will stay queued");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("mailflow-send-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Offers a freshly registered job key to the hot queue.
   *
   * @return {@code false} if the queue is full or the dispatcher is closing; the poller will
   *     find the row later
   */
  public boolean submit(String jobKey) {
    if (!accepting.get()) {
      return false;
    }
    boolean enqueued = hotQueue.offer(jobKey);
    if (enqueued) {
      metrics.incrementHotEnqueued();
    } else {
      metrics.incrementHotDropped();
    }
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  /**
   * Offers a job key found by the poller to the cold queue.
   */
  public boolean submitCold(String jobKey) {
    if (!accepting.get()) {
      return false;
    }
    boolean enqueued = coldQueue.offer(jobKey);
    if (enqueued) {
      metrics.incrementColdEnqueued();
    }
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  public int coldQueueRemainingCapacity() {
    return coldQueue.remainingCapacity();
  }

  /** Workers finish their current row and then stop taking new ones until {@link #resume()}. */
  public void pause() {
    paused.set(true);
  }

  public void resume() {
    paused.set(false);
  }

  public boolean isPaused() {
    return paused.get();
  }

  public QueueStatus status() {
    if (!accepting.get()) {
      return QueueStatus.unavailable("send");
    }
    return new QueueStatus("send", true, paused.get(),
        hotQueue.size() + coldQueue.size(), active.get(), workerCount);
  }

  private String pollFairly() throws InterruptedException {
    int cycle = pollCounter.getAndIncrement();
    BlockingQueue<String> primary;
    BlockingQueue<String> secondary;
    // Mask sign bit to stay non-negative after int overflow
    if ((cycle & 0x7FFFFFFF) % 3 == 2) {
      primary = coldQueue;
      secondary = hotQueue;
    } else {
      primary = hotQueue;
      secondary = coldQueue;
    }
    String jobKey = primary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    if (jobKey == null) {
      jobKey = secondary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }
    return jobKey;
  }

  private void workerLoop() {
    String owner = workerId + "/" + Thread.currentThread().getName();
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && hotQueue.isEmpty() && coldQueue.isEmpty()) {
          break;
        }
        if (paused.get() && running.get()) {
          Thread.sleep(QUEUE_POLL_TIMEOUT_MS);
          continue;
        }
        String jobKey = pollFairly();
        if (jobKey == null) {
          if (!running.get()) {
            break;
          }
          continue;
        }
        process(jobKey, owner);
        metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Send worker loop error", t);
      }
    }
  }

  /**
   * Runs one job key through claim, send and release on the calling thread.
   *
   * @return the status the row was left in, or empty when the key was already being processed
   *     locally or this owner lost the row (at claim or at any later mark)
   */
  public Optional<SendStatus> process(String jobKey, String owner) {
    if (!inFlightTracker.tryAcquire(jobKey)) {
      return Optional.empty();
    }
    active.incrementAndGet();
    try {
      Optional<SendEntry> claimed = ledger.claim(jobKey, owner);
      if (claimed.isEmpty()) {
        metrics.incrementClaimContended();
        logger.log(Level.FINE, "Claim lost for jobKey={0}", jobKey);
        return Optional.empty();
      }
      return deliver(claimed.get(), owner);
    } finally {
      active.decrementAndGet();
      inFlightTracker.release(jobKey);
    }
  }

  private Optional<SendStatus> deliver(SendEntry entry, String owner) {
    String jobKey = entry.jobKey();
    try {
      if (suppressionList.isSuppressed(entry.recipient())) {
        if (!ledger.markSkipped(jobKey, owner, "recipient suppressed")) {
          return lockLost(jobKey, "SKIPPED");
        }
        metrics.incrementSendSkipped();
        campaignCounters.recordOutcome(entry.campaignId(), SendStatus.SKIPPED);
        return Optional.of(SendStatus.SKIPPED);
      }
      // The provider is only called while this owner still holds the row
      if (!ledger.markSending(jobKey, owner)) {
        return lockLost(jobKey, "SENDING");
      }
      MessageContent content = contentProvider.contentFor(entry);
      DeliveryReceipt receipt = deliveryProvider.send(entry.recipient(), content);
      if (!ledger.markSent(jobKey, owner, receipt.externalId())) {
        logger.log(Level.WARNING, "Lock lost before SENT could be recorded for jobKey=" + jobKey);
        return Optional.empty();
      }
      metrics.incrementSendSuccess();
      campaignCounters.recordOutcome(entry.campaignId(), SendStatus.SENT);
      return Optional.of(SendStatus.SENT);
    } catch (Exception e) {
      return handleFailure(entry, owner, e);
    }
  }

  private Optional<SendStatus> lockLost(String jobKey, String target) {
    metrics.incrementClaimContended();
    logger.log(Level.FINE, "Lock lost before {0} for jobKey={1}; not sending", new Object[]{target, jobKey});
    return Optional.empty();
  }

  private Optional<SendStatus> handleFailure(SendEntry entry, String owner, Exception failure) {
    String jobKey = entry.jobKey();
    String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    Optional<SendStatus> result = ledger.markFailed(jobKey, owner, message);
    if (result.isEmpty()) {
      logger.log(Level.WARNING, "Lock lost before failure could be recorded for jobKey=" + jobKey, failure);
      return Optional.empty();
    }
    if (result.get() == SendStatus.FAILED) {
      metrics.incrementSendFailed();
      campaignCounters.recordOutcome(entry.campaignId(), SendStatus.FAILED);
      logger.log(Level.SEVERE, "Send FAILED after " + entry.attempts() + " attempts: jobKey=" + jobKey, failure);
    } else {
      metrics.incrementSendRetried();
      logger.log(Level.WARNING, "Send attempt " + entry.attempts() + " failed, will retry: jobKey=" + jobKey, failure);
    }
    return result;
  }

  /**
   * Stops accepting job keys, drains what is queued within the drain timeout, then stops the
   * workers.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    paused.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Hot remaining: " + hotQueue.size() + ", Cold remaining: " + coldQueue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link SendDispatcher}. */
  public static final class Builder {
    private SendLedger ledger;
    private DeliveryProvider deliveryProvider;
    private CampaignContentProvider contentProvider;
    private SuppressionList suppressionList;
    private CampaignCounters campaignCounters;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private String workerId;
    private int workerCount = 5;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private long drainTimeoutMs = 5000;

    private Builder() {
    }

    /**
     * Sets the ledger that rows are claimed from and released to.
     *
     * <p><b>Required.</b>
     */
    public Builder ledger(SendLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryProvider(DeliveryProvider deliveryProvider) {
      this.deliveryProvider = deliveryProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder contentProvider(CampaignContentProvider contentProvider) {
      this.contentProvider = contentProvider;
      return this;
    }

    /** Optional. Defaults to {@link SuppressionList#NONE}. */
    public Builder suppressionList(SuppressionList suppressionList) {
      this.suppressionList = suppressionList;
      return this;
    }

    /** Optional. Defaults to {@link CampaignCounters#NOOP}. */
    public Builder campaignCounters(CampaignCounters campaignCounters) {
      this.campaignCounters = campaignCounters;
      return this;
    }

    /** Optional. Defaults to {@link DefaultInFlightTracker}. */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Prefix of the lock owner id written to claimed rows; each worker thread appends its name.
     *
     * <p>Optional. Defaults to a random {@code dispatcher-xxxxxxxx}.
     */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Number of concurrent sends. Bounds the load put on the delivery provider.
     *
     * <p>Optional. Defaults to {@code 5}. {@code 0} starts no workers (testing only).
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. */
    public Builder hotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. */
    public Builder coldQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the dispatcher and starts its workers.
     *
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if {@code workerCount < 0} or a queue capacity is &le; 0
     */
    public SendDispatcher build() {
      return new SendDispatcher(this);
    }
  }
}
