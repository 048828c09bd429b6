package mailflow.flow;

import com.github.f4b6a3.ulid.UlidCreator;
import mailflow.model.ExecutionContext;
import mailflow.model.ExecutionStatus;
import mailflow.model.FlowDefinition;
import mailflow.model.FlowExecution;
import mailflow.model.FlowStatus;
import mailflow.model.StepResult;
import mailflow.model.StepSignal;
import mailflow.model.TriggerEvent;
import mailflow.spi.ConnectionProvider;
import mailflow.spi.CustomerDirectory;
import mailflow.spi.FlowDefinitionStore;
import mailflow.spi.FlowExecutionStore;
import mailflow.spi.StepSignalStore;
import mailflow.util.Transactions;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts, cancels and inspects flow executions.
 *
 * <p>Starting an execution writes the execution row, its first step signal and the flow's
 * counters in one transaction; from there the {@link StepWorker} drives it.
 *
 * <p>The "one open execution per flow and customer" check in {@link #processTrigger} is a
 * read before insert. Two concurrent triggers for the same customer can both pass it.
 */
public final class FlowEngine {
  private static final Logger logger = Logger.getLogger(FlowEngine.class.getName());

  private final ConnectionProvider connectionProvider;
  private final FlowDefinitionStore flowStore;
  private final FlowExecutionStore executionStore;
  private final StepSignalStore signalStore;
  private final CustomerDirectory customerDirectory;
  private final Clock clock;

  private FlowEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.flowStore = Objects.requireNonNull(builder.flowStore, "flowStore");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.signalStore = Objects.requireNonNull(builder.signalStore, "signalStore");
    this.customerDirectory = Objects.requireNonNull(builder.customerDirectory, "customerDirectory");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts every active flow whose trigger matches the event, unless the customer is already
   * running that flow.
   *
   * @return the executions started, possibly empty
   */
  public List<FlowExecution> processTrigger(TriggerEvent event) {
    Objects.requireNonNull(event, "event");
    List<FlowDefinition> candidates = Transactions.withConnection(connectionProvider,
        "load flows for " + event.type(), conn -> flowStore.findActiveByTrigger(conn, event.type()));
    List<FlowExecution> started = new ArrayList<>();
    for (FlowDefinition flow : candidates) {
      if (!shouldExecute(flow, event)) {
        continue;
      }
      started.add(startFlow(flow, event.customerId()));
    }
    return started;
  }

  /**
   * Whether {@code event} should start {@code flow} now: the flow is active, its trigger
   * matches, and the customer has no open execution of it.
   */
  public boolean shouldExecute(FlowDefinition flow, TriggerEvent event) {
    if (flow.status() != FlowStatus.ACTIVE || !flow.trigger().matches(event)) {
      return false;
    }
    boolean open = Transactions.withConnection(connectionProvider, "check open executions",
        conn -> executionStore.hasOpenExecution(conn, flow.flowId(), event.customerId()));
    if (open) {
      logger.log(Level.FINE, "Customer {0} is already in flow {1}; not starting again",
          new Object[]{event.customerId(), flow.flowId()});
    }
    return !open;
  }

  /**
   * Creates an {@code ACTIVE} execution at step 0 and schedules its first step.
   */
  public FlowExecution startFlow(FlowDefinition flow, String customerId) {
    Objects.requireNonNull(flow, "flow");
    Objects.requireNonNull(customerId, "customerId");
    Instant now = now();
    FlowExecution execution = new FlowExecution(UlidCreator.getMonotonicUlid().toString(), flow.flowId(), customerId,
        ExecutionStatus.ACTIVE, 0, new TreeSet<>(), ExecutionContext.EMPTY, null, null, 0L, now, now, null);
    StepSignal first = StepSignal.create(flow.flowId(), execution.executionId(), 0, now, now);
    Transactions.inTransaction(connectionProvider, "start flow " + flow.flowId(), conn -> {
      executionStore.insert(conn, execution);
      signalStore.insert(conn, first);
      flowStore.addToMetrics(conn, flow.flowId(), 1, 1, 0, 0);
      return null;
    });
    logger.log(Level.FINE, "Started execution {0} of flow {1} for customer {2}",
        new Object[]{execution.executionId(), flow.flowId(), customerId});
    return execution;
  }

  /**
   * Starts a flow for one customer by hand, regardless of its trigger or status.
   *
   * @throws IllegalArgumentException if the flow or the customer does not exist
   */
  public FlowExecution testFlow(String flowId, String customerId) {
    FlowDefinition flow = flow(flowId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown flow: " + flowId));
    if (customerDirectory.find(customerId).isEmpty()) {
      throw new IllegalArgumentException("Unknown customer: " + customerId);
    }
    return startFlow(flow, customerId);
  }

  /**
   * Cancels an {@code ACTIVE} or {@code WAITING} execution. Pending signals stay queued and are
   * discarded when they arrive.
   *
   * @return {@code false} if the execution is unknown or already finished
   */
  public boolean cancel(String executionId) {
    Instant now = now();
    return Transactions.inTransaction(connectionProvider, "cancel " + executionId, conn -> {
      Optional<FlowExecution> execution = executionStore.find(conn, executionId);
      if (execution.isEmpty() || !executionStore.cancel(conn, executionId, now)) {
        return false;
      }
      flowStore.addToMetrics(conn, execution.get().flowId(), 0, -1, 0, 0);
      return true;
    });
  }

  public Optional<FlowExecution> execution(String executionId) {
    return Transactions.withConnection(connectionProvider, "load execution",
        conn -> executionStore.find(conn, executionId));
  }

  public List<StepResult> stepResults(String executionId) {
    return Transactions.withConnection(connectionProvider, "load step results",
        conn -> executionStore.stepResults(conn, executionId));
  }

  /**
   * @param status only executions in this status, or {@code null} for all
   */
  public List<FlowExecution> executions(String flowId, ExecutionStatus status, int limit) {
    return Transactions.withConnection(connectionProvider, "list executions",
        conn -> executionStore.findByFlow(conn, flowId, status, limit));
  }

  public void saveFlow(FlowDefinition flow) {
    Transactions.withConnection(connectionProvider, "save flow " + flow.flowId(), conn -> {
      flowStore.save(conn, flow);
      return null;
    });
  }

  public Optional<FlowDefinition> flow(String flowId) {
    return Transactions.withConnection(connectionProvider, "load flow",
        conn -> flowStore.find(conn, flowId));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  /** Builder for {@link FlowEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private FlowDefinitionStore flowStore;
    private FlowExecutionStore executionStore;
    private StepSignalStore signalStore;
    private CustomerDirectory customerDirectory;
    private Clock clock;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
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

    /** <b>Required.</b> Used by {@link FlowEngine#testFlow}. */
    public Builder customerDirectory(CustomerDirectory customerDirectory) {
      this.customerDirectory = customerDirectory;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public FlowEngine build() {
      return new FlowEngine(this);
    }
  }
}
