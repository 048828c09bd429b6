package mailflow.jdbc.store;

import mailflow.jdbc.JdbcTemplate;
import mailflow.model.FlowDefinition;
import mailflow.model.FlowMetrics;
import mailflow.model.FlowStatus;
import mailflow.model.Trigger;
import mailflow.model.TriggerType;
import mailflow.spi.FlowDefinitionStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC flow definition store. Portable across H2, PostgreSQL and MySQL.
 *
 * <p>The step list lives in one text column, encoded by {@link StepCodec}.
 */
public final class JdbcFlowDefinitionStore implements FlowDefinitionStore {
  private static final String TABLE = "flow_definition";
  private static final String COLUMNS = "flow_id, name, status, trigger_type, trigger_tag, trigger_segment, " +
      "steps, triggered, currently_active, completed, emails_sent, created_at, updated_at";

  private final StepCodec codec;
  private final JdbcTemplate.RowMapper<FlowDefinition> rowMapper;

  public JdbcFlowDefinitionStore() {
    this(new StepCodec());
  }

  public JdbcFlowDefinitionStore(StepCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.rowMapper = rs -> new FlowDefinition(
        rs.getString("flow_id"),
        rs.getString("name"),
        FlowStatus.valueOf(rs.getString("status")),
        new Trigger(TriggerType.valueOf(rs.getString("trigger_type")),
            rs.getString("trigger_tag"), rs.getString("trigger_segment")),
        this.codec.fromJson(rs.getString("steps")),
        new FlowMetrics(rs.getLong("triggered"), rs.getLong("currently_active"),
            rs.getLong("completed"), rs.getLong("emails_sent")),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"));
  }

  @Override
  public void save(Connection conn, FlowDefinition flow) {
    Instant updatedAt = flow.updatedAt() != null ? flow.updatedAt() : Instant.now();
    String steps = codec.toJson(flow.steps());
    Trigger trigger = flow.trigger();
    int updated = JdbcTemplate.update(conn, "UPDATE " + TABLE +
            " SET name=?, status=?, trigger_type=?, trigger_tag=?, trigger_segment=?, steps=?, updated_at=?" +
            " WHERE flow_id=?",
        flow.name(), flow.status().name(), trigger.type().name(), trigger.tagName(), trigger.segmentId(),
        steps, updatedAt, flow.flowId());
    if (updated > 0) {
      return;
    }
    FlowMetrics metrics = flow.metrics();
    JdbcTemplate.update(conn, "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
        flow.flowId(), flow.name(), flow.status().name(), trigger.type().name(), trigger.tagName(),
        trigger.segmentId(), steps, metrics.triggered(), metrics.currentlyActive(), metrics.completed(),
        metrics.emailsSent(), flow.createdAt() != null ? flow.createdAt() : updatedAt, updatedAt);
  }

  @Override
  public Optional<FlowDefinition> find(Connection conn, String flowId) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE flow_id=?",
        rowMapper, flowId);
  }

  @Override
  public List<FlowDefinition> findActiveByTrigger(Connection conn, TriggerType triggerType) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE status=? AND trigger_type=? ORDER BY created_at";
    return JdbcTemplate.query(conn, sql, rowMapper, FlowStatus.ACTIVE.name(), triggerType.name());
  }

  @Override
  public boolean delete(Connection conn, String flowId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE flow_id=?", flowId) == 1;
  }

  @Override
  public void addToMetrics(Connection conn, String flowId, long triggered, long currentlyActive,
      long completed, long emailsSent) {
    String sql = "UPDATE " + TABLE + " SET triggered=triggered+?, currently_active=currently_active+?," +
        " completed=completed+?, emails_sent=emails_sent+? WHERE flow_id=?";
    JdbcTemplate.update(conn, sql, triggered, currentlyActive, completed, emailsSent, flowId);
  }
}
