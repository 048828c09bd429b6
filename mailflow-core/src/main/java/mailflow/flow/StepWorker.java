package mailflow.flow;

import mailflow.model.Customer;
import mailflow.model.ExecutionContext;
import mailflow.model.ExecutionStatus;
import mailflow.model.FlowDefinition;
import mailflow.model.FlowExecution;
import mailflow.model.IssuedDiscount;
import mailflow.model.Step;
import mailflow.model.StepOutcome;
import mailflow.model.StepResult;
import mailflow.model.StepSignal;
import mailflow.scheduler.InvalidSignalException;
import mailflow.scheduler.StepHandler;
import mailflow.spi.ConnectionProvider;
import mailflow.spi.CustomerDirectory;
import mailflow.spi.DeliveryProvider;
import mailflow.spi.DeliveryReceipt;
import mailflow.spi.FlowDefinitionStore;
import mailflow.spi.FlowExecutionStore;
import mailflow.spi.MessageContent;
import mailflow.spi.OrderDirectory;
import mailflow.spi.StepSignalStore;
import mailflow.spi.StorefrontClient;
import mailflow.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes one step of one flow execution per delivered signal.
 *
 * <p>The execution record is the source of truth; a signal is only a hint. A signal is
 * <ul>
 *   <li>dead-lettered when its payload is incomplete,</li>
 *   <li>discarded when the execution is gone or finished, when its step already completed, or
 *       when it runs ahead of the next expected step,</li>
 *   <li>turned into a {@code FAILED} execution when the flow or the customer was deleted.</li>
 * </ul>
 *
 * <p>After a step runs, its result row, the execution's new state and the next step's signal
 * are written in one transaction guarded by the execution version. A {@code WAIT} step leaves
 * the execution {@code WAITING} and schedules the next signal at the resume time; nothing
 * else moves it forward. Redelivering a signal therefore never changes state twice.
 *
 * <p>A step that throws records the error on the execution. On the signal's last attempt the
 * execution becomes {@code FAILED}. The exception is rethrown so the scheduler can back off.
 */
public final class StepWorker implements StepHandler {
  private static final Logger logger = Logger.getLogger(StepWorker.class.getName());

  private final ConnectionProvider connectionProvider;
  private final FlowDefinitionStore flowStore;
  private final FlowExecutionStore executionStore;
  private final StepSignalStore signalStore;
  private final CustomerDirectory customerDirectory;
  private final DeliveryProvider deliveryProvider;
  private final StorefrontClient storefrontClient;
  private final ConditionEvaluator conditions;
  private final Clock clock;

  private StepWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.flowStore = Objects.requireNonNull(builder.flowStore, "flowStore");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.signalStore = Objects.requireNonNull(builder.signalStore, "signalStore");
    this.customerDirectory = Objects.requireNonNull(builder.customerDirectory, "customerDirectory");
    this.deliveryProvider = Objects.requireNonNull(builder.deliveryProvider, "deliveryProvider");
    this.storefrontClient = builder.storefrontClient != null ? builder.storefrontClient : StorefrontClient.UNAVAILABLE;
    this.conditions = new ConditionEvaluator(Objects.requireNonNull(builder.orderDirectory, "orderDirectory"));
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void handle(StepSignal signal, boolean lastAttempt) throws Exception {
    if (!signal.isComplete()) {
      throw new InvalidSignalException("Incomplete step signal " + signal.signalId()
          + ": flowId=" + signal.flowId() + ", executionId=" + signal.executionId()
          + ", stepIndex=" + signal.stepIndex());
    }
    int index = signal.stepIndex();
    FlowExecution execution = read(conn -> executionStore.find(conn, signal.executionId())).orElse(null);
    if (execution == null) {
      logger.log(Level.FINE, "Execution {0} no longer exists; discarding step {1}",
          new Object[]{signal.executionId(), index});
      return;
    }
    if (!execution.flowId().equals(signal.flowId())) {
      throw new InvalidSignalException("Signal " + signal.signalId() + " names flow " + signal.flowId()
          + " but execution " + execution.executionId() + " belongs to " + execution.flowId());
    }
    if (execution.status().isTerminal()) {
      logger.log(Level.FINE, "Execution {0} is {1}; discarding step {2}",
          new Object[]{execution.executionId(), execution.status(), index});
      return;
    }
    FlowDefinition flow = read(conn -> flowStore.find(conn, execution.flowId())).orElse(null);
    if (flow == null) {
      failDetached(execution, "flow deleted", false);
      return;
    }
    if (execution.isCompleted(index)) {
      logger.log(Level.FINE, "Step {0} of execution {1} already completed; ignoring duplicate",
          new Object[]{index, execution.executionId()});
      return;
    }
    if (index != execution.nextExpectedStep()) {
      logger.log(Level.FINE, "Step {0} of execution {1} is out of order (expected {2}); discarding",
          new Object[]{index, execution.executionId(), execution.nextExpectedStep()});
      return;
    }
    if (!flow.hasStep(index)) {
      finish(execution, flow);
      return;
    }
    Customer customer = customerDirectory.find(execution.customerId()).orElse(null);
    if (customer == null) {
      failDetached(execution, "customer deleted", true);
      return;
    }

    Step step = flow.steps().get(index);
    StepRun run;
    try {
      run = execute(step, execution, customer);
    } catch (Exception e) {
      recordFailure(execution, e, lastAttempt);
      throw e;
    }
    complete(execution, flow, index, step, run);
  }

  private StepRun execute(Step step, FlowExecution execution, Customer customer) throws Exception {
    ExecutionContext context = execution.context();
    return switch (step.type()) {
      case SEND_EMAIL -> sendEmail((Step.SendEmail) step, execution, customer, context);
      case WAIT -> {
        Step.Wait wait = (Step.Wait) step;
        yield new StepRun(StepOutcome.WAITED, wait.delayMinutes() + " minutes", context,
            Duration.ofMinutes(wait.delayMinutes()), 0);
      }
      case CONDITION -> branch((Step.Condition) step, execution, customer, context);
      case ADD_TAG -> addTag((Step.AddTag) step, customer, context);
      case CREATE_DISCOUNT -> createDiscount((Step.CreateDiscount) step, customer, context);
    };
  }

  private StepRun runAction(Step.Action action, FlowExecution execution, Customer customer,
      ExecutionContext context) throws Exception {
    return switch (action.type()) {
      case SEND_EMAIL -> sendEmail((Step.SendEmail) action, execution, customer, context);
      case ADD_TAG -> addTag((Step.AddTag) action, customer, context);
      case CREATE_DISCOUNT -> createDiscount((Step.CreateDiscount) action, customer, context);
      case WAIT, CONDITION -> throw new IllegalStateException("Not an action: " + action.type());
    };
  }

  private StepRun sendEmail(Step.SendEmail step, FlowExecution execution, Customer customer,
      ExecutionContext context) throws Exception {
    if (!customer.isMailable()) {
      String reason = customer.email() == null || customer.email().isBlank() ? "no address"
          : customer.bounced() ? "bounced" : "unsubscribed";
      logger.log(Level.FINE, "Skipping email to customer {0}: {1}",
          new Object[]{customer.customerId(), reason});
      return new StepRun(StepOutcome.SKIPPED, reason, context, null, 0);
    }
    Map<String, String> variables = new HashMap<>();
    variables.put("customerId", customer.customerId());
    variables.put("flowId", execution.flowId());
    variables.put("executionId", execution.executionId());
    if (context.discount() != null) {
      variables.put("discountCode", context.discount().code());
    }
    MessageContent content = new MessageContent(step.subject(), step.templateId(), step.htmlContent(), variables);
    DeliveryReceipt receipt = deliveryProvider.send(customer.email(), content);
    return new StepRun(StepOutcome.SENT, receipt.externalId(),
        context.withLastMessageId(receipt.externalId()), null, 1);
  }

  private StepRun branch(Step.Condition condition, FlowExecution execution, Customer customer,
      ExecutionContext context) throws Exception {
    boolean met = conditions.test(condition, customer);
    List<Step.Action> actions = met ? condition.ifTrue() : condition.ifFalse();
    ExecutionContext current = context;
    int emails = 0;
    for (Step.Action action : actions) {
      StepRun run = runAction(action, execution, customer, current);
      current = run.context();
      emails += run.emailsSent();
    }
    return new StepRun(StepOutcome.BRANCHED,
        condition.conditionType() + "=" + met + ", " + actions.size() + " actions", current, null, emails);
  }

  private StepRun addTag(Step.AddTag step, Customer customer, ExecutionContext context) {
    customerDirectory.addTag(customer.customerId(), step.tagName());
    if (customer.storefrontId() != null) {
      try {
        storefrontClient.tagCustomer(customer.storefrontId(), step.tagName());
      } catch (RuntimeException e) {
        // No reconciliation: the storefront stays untagged until someone re-syncs it
        logger.log(Level.WARNING, "Failed to mirror tag " + step.tagName()
            + " to storefront customer " + customer.storefrontId(), e);
      }
    }
    return new StepRun(StepOutcome.TAGGED, step.tagName(), context, null, 0);
  }

  private StepRun createDiscount(Step.CreateDiscount step, Customer customer, ExecutionContext context) {
    String code = DiscountCodes.codeFor(step.codePrefix(), customer.customerId());
    Instant expiresAt = step.expiresInDays() > 0 ? now().plus(Duration.ofDays(step.expiresInDays())) : null;
    IssuedDiscount discount = new IssuedDiscount(code, step.discountType(), step.value(), expiresAt);
    storefrontClient.createDiscount(customer.storefrontId(), discount);
    return new StepRun(StepOutcome.DISCOUNT_ISSUED, code, context.withDiscount(discount), null, 0);
  }

  private void complete(FlowExecution execution, FlowDefinition flow, int index, Step step, StepRun run) {
    Instant now = now();
    FlowExecution next;
    StepSignal nextSignal = null;
    boolean finished = false;
    if (run.delay() != null) {
      Instant resumeAt = now.plus(run.delay());
      next = transition(execution, ExecutionStatus.WAITING, index, run.context(), resumeAt, now, null);
      nextSignal = StepSignal.create(flow.flowId(), execution.executionId(), index + 1, resumeAt, now);
    } else if (flow.hasStep(index + 1)) {
      next = transition(execution, ExecutionStatus.ACTIVE, index + 1, run.context(), null, now, null);
      nextSignal = StepSignal.create(flow.flowId(), execution.executionId(), index + 1, now, now);
    } else {
      next = transition(execution, ExecutionStatus.COMPLETED, index, run.context(), null, now, now);
      finished = true;
    }
    StepResult result = new StepResult(execution.executionId(), index, step.type(), run.outcome(), run.detail(), now);
    StepSignal signal = nextSignal;
    boolean completed = finished;

    boolean applied = Transactions.inTransaction(connectionProvider, "complete step " + index, conn -> {
      if (!executionStore.update(conn, next, execution.version())) {
        return false;
      }
      if (!executionStore.insertStepResult(conn, result)) {
        throw new IllegalStateException("Step " + index + " of execution "
            + execution.executionId() + " was completed concurrently");
      }
      if (signal != null) {
        signalStore.insert(conn, signal);
      }
      if (completed || run.emailsSent() > 0) {
        flowStore.addToMetrics(conn, flow.flowId(), 0, completed ? -1 : 0, completed ? 1 : 0, run.emailsSent());
      }
      return true;
    });
    if (!applied) {
      logger.log(Level.FINE, "Execution {0} changed while step {1} ran; dropping this delivery",
          new Object[]{execution.executionId(), index});
    } else if (completed) {
      logger.log(Level.INFO, "Execution {0} of flow {1} completed",
          new Object[]{execution.executionId(), flow.flowId()});
    }
  }

  /** Closes an execution whose last step was a wait. */
  private void finish(FlowExecution execution, FlowDefinition flow) {
    Instant now = now();
    FlowExecution next = transition(execution, ExecutionStatus.COMPLETED, execution.currentStep(),
        execution.context(), null, now, now);
    boolean applied = Transactions.inTransaction(connectionProvider, "finish " + execution.executionId(), conn -> {
      if (!executionStore.update(conn, next, execution.version())) {
        return false;
      }
      flowStore.addToMetrics(conn, flow.flowId(), 0, -1, 1, 0);
      return true;
    });
    if (applied) {
      logger.log(Level.INFO, "Execution {0} of flow {1} completed",
          new Object[]{execution.executionId(), flow.flowId()});
    }
  }

  private void failDetached(FlowExecution execution, String reason, boolean flowExists) {
    Transactions.inTransaction(connectionProvider, "fail " + execution.executionId(), conn -> {
      if (executionStore.markFailed(conn, execution.executionId(), reason, now()) && flowExists) {
        flowStore.addToMetrics(conn, execution.flowId(), 0, -1, 0, 0);
      }
      return null;
    });
    logger.log(Level.INFO, "Execution {0} failed: {1}", new Object[]{execution.executionId(), reason});
  }

  private void recordFailure(FlowExecution execution, Exception failure, boolean lastAttempt) {
    String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    try {
      Transactions.inTransaction(connectionProvider, "record failure of " + execution.executionId(), conn -> {
        if (!lastAttempt) {
          executionStore.recordError(conn, execution.executionId(), message, now());
        } else if (executionStore.markFailed(conn, execution.executionId(), message, now())) {
          flowStore.addToMetrics(conn, execution.flowId(), 0, -1, 0, 0);
        }
        return null;
      });
      if (lastAttempt) {
        logger.log(Level.SEVERE, "Execution " + execution.executionId() + " failed at step "
            + execution.nextExpectedStep(), failure);
      }
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  private static FlowExecution transition(FlowExecution from, ExecutionStatus status, int currentStep,
      ExecutionContext context, Instant resumeAt, Instant now, Instant finishedAt) {
    return new FlowExecution(from.executionId(), from.flowId(), from.customerId(), status, currentStep,
        from.completedSteps(), context, null, resumeAt, from.version() + 1, from.createdAt(), now, finishedAt);
  }

  private <T> T read(Transactions.SqlWork<T> work) {
    return Transactions.withConnection(connectionProvider, "read flow state", work);
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private record StepRun(StepOutcome outcome, String detail, ExecutionContext context, Duration delay,
      int emailsSent) {
  }

  /** Builder for {@link StepWorker}. All collaborators except the storefront are required. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private FlowDefinitionStore flowStore;
    private FlowExecutionStore executionStore;
    private StepSignalStore signalStore;
    private CustomerDirectory customerDirectory;
    private OrderDirectory orderDirectory;
    private DeliveryProvider deliveryProvider;
    private StorefrontClient storefrontClient;
    private Clock clock;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder flowStore(FlowDefinitionStore flowStore) {
      this.flowStore = flowStore;
      return this;
    }

    public Builder executionStore(FlowExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    public Builder signalStore(StepSignalStore signalStore) {
      this.signalStore = signalStore;
      return this;
    }

    public Builder customerDirectory(CustomerDirectory customerDirectory) {
      this.customerDirectory = customerDirectory;
      return this;
    }

    public Builder orderDirectory(OrderDirectory orderDirectory) {
      this.orderDirectory = orderDirectory;
      return this;
    }

    public Builder deliveryProvider(DeliveryProvider deliveryProvider) {
      this.deliveryProvider = deliveryProvider;
      return this;
    }

    /** Optional. Defaults to {@link StorefrontClient#UNAVAILABLE}. */
    public Builder storefrontClient(StorefrontClient storefrontClient) {
      this.storefrontClient = storefrontClient;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public StepWorker build() {
      return new StepWorker(this);
    }
  }
}
