package mailflow;

import mailflow.dispatch.RetryPolicy;
import mailflow.dispatch.SendDispatcher;
import mailflow.dispatch.SendPoller;
import mailflow.flow.FlowEngine;
import mailflow.flow.StepWorker;
import mailflow.ledger.SendLedger;
import mailflow.model.FlowExecution;
import mailflow.model.Recipient;
import mailflow.model.RegistrationResult;
import mailflow.model.TriggerEvent;
import mailflow.recovery.LockRecoverySweeper;
import mailflow.scheduler.StepScheduler;
import mailflow.spi.CampaignContentProvider;
import mailflow.spi.CampaignCounters;
import mailflow.spi.ConnectionProvider;
import mailflow.spi.CustomerDirectory;
import mailflow.spi.DeliveryProvider;
import mailflow.spi.FlowDefinitionStore;
import mailflow.spi.FlowExecutionStore;
import mailflow.spi.MetricsExporter;
import mailflow.spi.OrderDirectory;
import mailflow.spi.SendLedgerStore;
import mailflow.spi.StepSignalStore;
import mailflow.spi.StorefrontClient;
import mailflow.spi.SuppressionList;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite runtime holding the send ledger, its dispatcher, poller and lock sweeper, and the
 * flow engine with its step scheduler.
 *
 * <p>{@link Builder#build()} creates every component; the dispatcher's workers start at once.
 * {@link #start()} starts the background loops (send poller, lock sweeper, step scheduler).
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Mailflow mailflow = Mailflow.builder()
 *     .connectionProvider(connectionProvider)
 *     .ledgerStore(stores.ledger())
 *     .flowStore(stores.flows())
 *     .executionStore(stores.executions())
 *     .signalStore(stores.signals())
 *     .deliveryProvider(provider)
 *     .contentProvider(content)
 *     .customerDirectory(customers)
 *     .orderDirectory(orders)
 *     .build()) {
 *   mailflow.start();
 *   mailflow.register(recipients);
 * }
 * }</pre>
 */
public final class Mailflow implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Mailflow.class.getName());

  private final SendLedger ledger;
  private final SendDispatcher dispatcher;
  private final SendPoller poller;
  private final LockRecoverySweeper sweeper;
  private final FlowEngine engine;
  private final StepScheduler scheduler;
  private final MetricsExporter metrics;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile boolean closed;

  private Mailflow(SendLedger ledger, SendDispatcher dispatcher, SendPoller poller,
      LockRecoverySweeper sweeper, FlowEngine engine, StepScheduler scheduler, MetricsExporter metrics) {
    this.ledger = ledger;
    this.dispatcher = dispatcher;
    this.poller = poller;
    this.sweeper = sweeper;
    this.engine = engine;
    this.scheduler = scheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Starts the send poller, the lock sweeper and the step scheduler. Idempotent. */
  public void start() {
    if (closed) {
      throw new IllegalStateException("Mailflow has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    poller.start();
    sweeper.start();
    scheduler.start();
    logger.info("Mailflow started");
  }

  /**
   * Registers recipients in the ledger and offers every newly created job key to the
   * dispatcher's hot queue. Keys that do not fit are picked up by the poller.
   */
  public RegistrationResult register(List<Recipient> recipients) {
    RegistrationResult result = ledger.bulkRegister(recipients);
    for (String jobKey : result.createdKeys()) {
      dispatcher.submit(jobKey);
    }
    return result;
  }

  /** Starts every matching active flow for the event's customer. */
  public List<FlowExecution> trigger(TriggerEvent event) {
    return engine.processTrigger(event);
  }

  /** Queues one flow step; also resumes a waiting execution by hand. */
  public String enqueueFlowStep(String flowId, String executionId, int stepIndex, Duration delay) {
    return scheduler.enqueueFlowStep(flowId, executionId, stepIndex, delay);
  }

  public QueueStatus sendQueueStatus() {
    if (!started.get() || closed) {
      return QueueStatus.unavailable("send");
    }
    return dispatcher.status();
  }

  public QueueStatus stepQueueStatus() {
    return scheduler.status();
  }

  public SendLedger ledger() {
    return ledger;
  }

  public SendDispatcher dispatcher() {
    return dispatcher;
  }

  public SendPoller poller() {
    return poller;
  }

  public LockRecoverySweeper sweeper() {
    return sweeper;
  }

  public FlowEngine engine() {
    return engine;
  }

  public StepScheduler scheduler() {
    return scheduler;
  }

  /**
   * Shuts down in order: step scheduler, lock sweeper, send poller, dispatcher, metrics.
   * Every component is closed even if an earlier one throws.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    List<AutoCloseable> components = new ArrayList<>(List.of(scheduler, sweeper, poller, dispatcher));
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Mailflow}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SendLedgerStore ledgerStore;
    private FlowDefinitionStore flowStore;
    private FlowExecutionStore executionStore;
    private StepSignalStore signalStore;
    private DeliveryProvider deliveryProvider;
    private CampaignContentProvider contentProvider;
    private CustomerDirectory customerDirectory;
    private OrderDirectory orderDirectory;
    private StorefrontClient storefrontClient = StorefrontClient.UNAVAILABLE;
    private SuppressionList suppressionList = SuppressionList.NONE;
    private CampaignCounters campaignCounters = CampaignCounters.NOOP;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();
    private String workerId;
    private Duration lockTimeout = SendLedger.DEFAULT_LOCK_TIMEOUT;
    private int maxAttempts = SendLedger.DEFAULT_MAX_ATTEMPTS;
    private RetryPolicy retryPolicy;
    private int workerCount = 5;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private long drainTimeoutMs = 5000;
    private long pollIntervalMs = 5000;
    private int pollBatchSize = 100;
    private long sweepIntervalSeconds = 60;
    private long stepIntervalMs = 1000;
    private int stepBatchSize = 50;
    private int stepWorkerCount = 5;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder ledgerStore(SendLedgerStore ledgerStore) {
      this.ledgerStore = ledgerStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder flowStore(FlowDefinitionStore flowStore) {
      this.flowStore = flowStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder executionStore(FlowExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder signalStore(StepSignalStore signalStore) {
      this.signalStore = signalStore;
      return this;
    }

    /** <b>Required.</b> Used by campaign sends and flow emails alike. */
    public Builder deliveryProvider(DeliveryProvider deliveryProvider) {
      this.deliveryProvider = deliveryProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder contentProvider(CampaignContentProvider contentProvider) {
      this.contentProvider = contentProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder customerDirectory(CustomerDirectory customerDirectory) {
      this.customerDirectory = customerDirectory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder orderDirectory(OrderDirectory orderDirectory) {
      this.orderDirectory = orderDirectory;
      return this;
    }

    /** Optional. Defaults to {@link StorefrontClient#UNAVAILABLE}. */
    public Builder storefrontClient(StorefrontClient storefrontClient) {
      this.storefrontClient = Objects.requireNonNull(storefrontClient, "storefrontClient");
      return this;
    }

    /** Optional. Defaults to {@link SuppressionList#NONE}. */
    public Builder suppressionList(SuppressionList suppressionList) {
      this.suppressionList = Objects.requireNonNull(suppressionList, "suppressionList");
      return this;
    }

    /** Optional. Defaults to {@link CampaignCounters#NOOP}. */
    public Builder campaignCounters(CampaignCounters campaignCounters) {
      this.campaignCounters = Objects.requireNonNull(campaignCounters, "campaignCounters");
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the runtime when it
     * implements {@link AutoCloseable}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /** Lock owner prefix for sends and steps. Optional. Defaults to a random id per component. */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /** Lock timeout for send rows and step signals. Optional. Defaults to 5 minutes. */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /** Attempts per send and per step signal. Optional. Defaults to {@code 3}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Optional. Defaults to exponential backoff with a 2 second base, capped at 5 minutes. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Concurrent sends. Optional. Defaults to {@code 5}. */
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

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 100}. */
    public Builder pollBatchSize(int pollBatchSize) {
      this.pollBatchSize = pollBatchSize;
      return this;
    }

    /** Optional. Defaults to 60 seconds. */
    public Builder sweepIntervalSeconds(long sweepIntervalSeconds) {
      this.sweepIntervalSeconds = sweepIntervalSeconds;
      return this;
    }

    /** Optional. Defaults to {@code 1000} ms. */
    public Builder stepIntervalMs(long stepIntervalMs) {
      this.stepIntervalMs = stepIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder stepBatchSize(int stepBatchSize) {
      this.stepBatchSize = stepBatchSize;
      return this;
    }

    /** Concurrent step executions. Optional. Defaults to {@code 5}. */
    public Builder stepWorkerCount(int stepWorkerCount) {
      this.stepWorkerCount = stepWorkerCount;
      return this;
    }

    /**
     * Builds all components. If a later component fails to build, the dispatcher is closed
     * before rethrowing.
     *
     * @throws IllegalStateException if called twice on the same builder
     */
    public Mailflow build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(ledgerStore, "ledgerStore");

      SendLedger.Builder lb = SendLedger.builder()
          .connectionProvider(connectionProvider)
          .store(ledgerStore)
          .clock(clock)
          .lockTimeout(lockTimeout)
          .maxAttempts(maxAttempts);
      if (retryPolicy != null) {
        lb.retryPolicy(retryPolicy);
      }
      SendLedger ledger = lb.build();

      SendDispatcher dispatcher = SendDispatcher.builder()
          .ledger(ledger)
          .deliveryProvider(deliveryProvider)
          .contentProvider(contentProvider)
          .suppressionList(suppressionList)
          .campaignCounters(campaignCounters)
          .metrics(metrics)
          .workerId(workerId)
          .workerCount(workerCount)
          .hotQueueCapacity(hotQueueCapacity)
          .coldQueueCapacity(coldQueueCapacity)
          .drainTimeoutMs(drainTimeoutMs)
          .build();
      try {
        SendPoller poller = SendPoller.builder()
            .ledger(ledger)
            .dispatcher(dispatcher)
            .batchSize(pollBatchSize)
            .intervalMs(pollIntervalMs)
            .build();
        LockRecoverySweeper sweeper = LockRecoverySweeper.builder()
            .ledger(ledger)
            .metrics(metrics)
            .intervalSeconds(sweepIntervalSeconds)
            .build();
        FlowEngine engine = FlowEngine.builder()
            .connectionProvider(connectionProvider)
            .flowStore(flowStore)
            .executionStore(executionStore)
            .signalStore(signalStore)
            .customerDirectory(customerDirectory)
            .clock(clock)
            .build();
        StepWorker worker = StepWorker.builder()
            .connectionProvider(connectionProvider)
            .flowStore(flowStore)
            .executionStore(executionStore)
            .signalStore(signalStore)
            .customerDirectory(customerDirectory)
            .orderDirectory(orderDirectory)
            .deliveryProvider(deliveryProvider)
            .storefrontClient(storefrontClient)
            .clock(clock)
            .build();
        StepScheduler.Builder sb = StepScheduler.builder()
            .connectionProvider(connectionProvider)
            .store(signalStore)
            .handler(worker)
            .clock(clock)
            .ownerId(workerId)
            .lockTimeout(lockTimeout)
            .intervalMs(stepIntervalMs)
            .batchSize(stepBatchSize)
            .workerCount(stepWorkerCount)
            .maxAttempts(maxAttempts)
            .metrics(metrics);
        if (retryPolicy != null) {
          sb.retryPolicy(retryPolicy);
        }
        return new Mailflow(ledger, dispatcher, poller, sweeper, engine, sb.build(), metrics);
      } catch (RuntimeException e) {
        dispatcher.close();
        throw e;
      }
    }
  }
}
