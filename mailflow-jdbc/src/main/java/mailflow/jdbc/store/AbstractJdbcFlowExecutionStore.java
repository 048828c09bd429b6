package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.DiscountType;
import mailflow.model.ExecutionContext;
import mailflow.model.ExecutionStatus;
import mailflow.model.FlowExecution;
import mailflow.model.IssuedDiscount;
import mailflow.model.StepOutcome;
import mailflow.model.StepResult;
import mailflow.model.StepType;
import mailflow.spi.FlowExecutionStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Base JDBC flow execution store.
 *
 * <p>The execution context is stored as flat columns. Completed steps are not stored on the
 * execution row; they are the rows of {@code flow_step_result}, whose primary key is
 * (execution_id, step_index). Subclasses supply an insert that reports a duplicate step result
 * without aborting the surrounding transaction. Register custom implementations via
 * {@code META-INF/services/mailflow.jdbc.store.AbstractJdbcFlowExecutionStore}.
 *
 * @see JdbcStores
 */
public abstract class AbstractJdbcFlowExecutionStore implements FlowExecutionStore, VendorSpecific {
  protected static final String TABLE = "flow_execution";
  protected static final String RESULT_TABLE = "flow_step_result";
  protected static final String RESULT_COLUMNS =
      "execution_id, step_index, step_type, outcome, detail, completed_at";
  protected static final String RESULT_VALUES = " (" + RESULT_COLUMNS + ") VALUES (?,?,?,?,?,?)";

  private static final int MAX_DETAIL_LENGTH = 1000;
  private static final String COLUMNS = "execution_id, flow_id, customer_id, status, current_step, " +
      "discount_code, discount_type, discount_value, discount_expires_at, last_message_id, " +
      "last_error, resume_at, version, created_at, updated_at, finished_at";
  private static final String OPEN_STATUS_IN =
      "(" + ExecutionStatus.ACTIVE.code() + "," + ExecutionStatus.WAITING.code() + ")";

  private static final JdbcTemplate.RowMapper<StepResult> RESULT_ROW_MAPPER = rs -> new StepResult(
      rs.getString("execution_id"),
      rs.getInt("step_index"),
      StepType.valueOf(rs.getString("step_type")),
      StepOutcome.valueOf(rs.getString("outcome")),
      rs.getString("detail"),
      JdbcTemplate.instant(rs, "completed_at"));

  /**
   * Inserts the step result row unless one exists for the same (execution, step index).
   *
   * @return rows inserted
   */
  protected abstract int insertResultIfAbsent(Connection conn, Object[] params);

  @Override
  public void insert(Connection conn, FlowExecution execution) {
    ExecutionContext ctx = execution.context();
    IssuedDiscount discount = ctx.discount();
    JdbcTemplate.update(conn, "INSERT INTO " + TABLE + " (" + COLUMNS + ")" +
            " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
        execution.executionId(), execution.flowId(), execution.customerId(), execution.status().code(),
        execution.currentStep(),
        discount == null ? null : discount.code(),
        discount == null ? null : discount.type().name(),
        discount == null ? null : discount.value(),
        discount == null ? null : discount.expiresAt(),
        ctx.lastMessageId(), JdbcTemplate.truncateError(execution.lastError()), execution.resumeAt(),
        execution.version(), execution.createdAt(), execution.updatedAt(), execution.finishedAt());
  }

  @Override
  public Optional<FlowExecution> find(Connection conn, String executionId) {
    Optional<ExecutionRow> row = JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE execution_id=?",
        AbstractJdbcFlowExecutionStore::mapRow, executionId);
    return row.map(r -> r.withCompletedSteps(completedSteps(conn, executionId)));
  }

  @Override
  public boolean hasOpenExecution(Connection conn, String flowId, String customerId) {
    String sql = "SELECT COUNT(*) AS cnt FROM " + TABLE +
        " WHERE flow_id=? AND customer_id=? AND status IN " + OPEN_STATUS_IN;
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong("cnt"), flowId, customerId).orElse(0L) > 0;
  }

  @Override
  public boolean update(Connection conn, FlowExecution execution, long expectedVersion) {
    ExecutionContext ctx = execution.context();
    IssuedDiscount discount = ctx.discount();
    String sql = "UPDATE " + TABLE + " SET status=?, current_step=?, discount_code=?, discount_type=?," +
        " discount_value=?, discount_expires_at=?, last_message_id=?, last_error=?, resume_at=?," +
        " updated_at=?, finished_at=?, version=version+1" +
        " WHERE execution_id=? AND version=?";
    return JdbcTemplate.update(conn, sql,
        execution.status().code(), execution.currentStep(),
        discount == null ? null : discount.code(),
        discount == null ? null : discount.type().name(),
        discount == null ? null : discount.value(),
        discount == null ? null : discount.expiresAt(),
        ctx.lastMessageId(), JdbcTemplate.truncateError(execution.lastError()), execution.resumeAt(),
        execution.updatedAt(), execution.finishedAt(), execution.executionId(), expectedVersion) == 1;
  }

  @Override
  public boolean insertStepResult(Connection conn, StepResult result) {
    String detail = result.detail();
    if (detail != null && detail.length() > MAX_DETAIL_LENGTH) {
      detail = detail.substring(0, MAX_DETAIL_LENGTH);
    }
    return insertResultIfAbsent(conn, new Object[]{result.executionId(), result.stepIndex(),
        result.stepType().name(), result.outcome().name(), detail, result.completedAt()}) == 1;
  }

  @Override
  public List<StepResult> stepResults(Connection conn, String executionId) {
    return JdbcTemplate.query(conn, "SELECT " + RESULT_COLUMNS + " FROM " + RESULT_TABLE +
        " WHERE execution_id=? ORDER BY step_index", RESULT_ROW_MAPPER, executionId);
  }

  @Override
  public boolean recordError(Connection conn, String executionId, String error, Instant now) {
    String sql = "UPDATE " + TABLE + " SET last_error=?, updated_at=?, version=version+1 WHERE execution_id=?";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.truncateError(error), now, executionId) == 1;
  }

  @Override
  public boolean markFailed(Connection conn, String executionId, String error, Instant now) {
    return finish(conn, executionId, ExecutionStatus.FAILED, JdbcTemplate.truncateError(error), now);
  }

  @Override
  public boolean cancel(Connection conn, String executionId, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + ExecutionStatus.CANCELLED.code() +
        ", resume_at=NULL, updated_at=?, finished_at=?, version=version+1" +
        " WHERE execution_id=? AND status IN " + OPEN_STATUS_IN;
    return JdbcTemplate.update(conn, sql, now, now, executionId) == 1;
  }

  @Override
  public List<FlowExecution> findByFlow(Connection conn, String flowId, ExecutionStatus status, int limit) {
    List<ExecutionRow> rows;
    if (status == null) {
      rows = JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + TABLE +
          " WHERE flow_id=? ORDER BY created_at LIMIT ?", AbstractJdbcFlowExecutionStore::mapRow, flowId, limit);
    } else {
      rows = JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + TABLE +
              " WHERE flow_id=? AND status=? ORDER BY created_at LIMIT ?",
          AbstractJdbcFlowExecutionStore::mapRow, flowId, status.code(), limit);
    }
    List<FlowExecution> executions = new ArrayList<>(rows.size());
    for (ExecutionRow row : rows) {
      executions.add(row.withCompletedSteps(completedSteps(conn, row.executionId)));
    }
    return executions;
  }

  private boolean finish(Connection conn, String executionId, ExecutionStatus status, String error, Instant now) {
    String sql = "UPDATE " + TABLE + " SET status=" + status.code() +
        ", last_error=?, resume_at=NULL, updated_at=?, finished_at=?, version=version+1" +
        " WHERE execution_id=? AND status IN " + OPEN_STATUS_IN;
    return JdbcTemplate.update(conn, sql, error, now, now, executionId) == 1;
  }

  private SortedSet<Integer> completedSteps(Connection conn, String executionId) {
    return new TreeSet<>(JdbcTemplate.query(conn,
        "SELECT step_index FROM " + RESULT_TABLE + " WHERE execution_id=?",
        rs -> rs.getInt("step_index"), executionId));
  }

  private static ExecutionRow mapRow(ResultSet rs) throws SQLException {
    String code = rs.getString("discount_code");
    IssuedDiscount discount = code == null ? null : new IssuedDiscount(code,
        DiscountType.valueOf(rs.getString("discount_type")),
        rs.getBigDecimal("discount_value"),
        JdbcTemplate.instant(rs, "discount_expires_at"));
    return new ExecutionRow(
        rs.getString("execution_id"),
        rs.getString("flow_id"),
        rs.getString("customer_id"),
        ExecutionStatus.fromCode(rs.getInt("status")),
        rs.getInt("current_step"),
        new ExecutionContext(discount, rs.getString("last_message_id")),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "resume_at"),
        rs.getLong("version"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"),
        JdbcTemplate.instant(rs, "finished_at"));
  }

  /** Execution row before its step results are attached. */
  private record ExecutionRow(String executionId, String flowId, String customerId, ExecutionStatus status,
      int currentStep, ExecutionContext context, String lastError, Instant resumeAt, long version,
      Instant createdAt, Instant updatedAt, Instant finishedAt) {

    FlowExecution withCompletedSteps(SortedSet<Integer> completedSteps) {
      return new FlowExecution(executionId, flowId, customerId, status, currentStep, completedSteps,
          context, lastError, resumeAt, version, createdAt, updatedAt, finishedAt);
    }
  }
}
