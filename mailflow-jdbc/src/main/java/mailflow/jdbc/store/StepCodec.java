package mailflow.jdbc.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import mailflow.model.ConditionType;
import mailflow.model.DiscountType;
import mailflow.model.Step;
import mailflow.model.StepType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Encodes a flow's step list as one JSON array. Each element carries a {@code type} field
 * naming its {@link StepType}; condition branches nest their actions the same way.
 *
 * <pre>{@code
 * [{"type":"SEND_EMAIL","subject":"Welcome"},
 *  {"type":"WAIT","delayMinutes":1440},
 *  {"type":"CONDITION","conditionType":"HAS_PURCHASED","ifTrue":[],"ifFalse":[...]}]
 * }</pre>
 */
public final class StepCodec {
  private final ObjectMapper mapper;

  public StepCodec() {
    this(new ObjectMapper());
  }

  public StepCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public String toJson(List<Step> steps) {
    ArrayNode array = mapper.createArrayNode();
    for (Step step : steps) {
      array.add(encode(step));
    }
    try {
      return mapper.writeValueAsString(array);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode steps", e);
    }
  }

  /**
   * @throws IllegalArgumentException if the JSON is malformed or names an unknown step type
   */
  public List<Step> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed step list", e);
    }
    if (!root.isArray()) {
      throw new IllegalArgumentException("Step list must be a JSON array");
    }
    List<Step> steps = new ArrayList<>();
    for (JsonNode node : root) {
      steps.add(decode(node));
    }
    return steps;
  }

  private ObjectNode encode(Step step) {
    ObjectNode node = mapper.createObjectNode();
    node.put("type", step.type().name());
    switch (step.type()) {
      case SEND_EMAIL -> {
        Step.SendEmail email = (Step.SendEmail) step;
        node.put("subject", email.subject());
        putIfPresent(node, "templateId", email.templateId());
        putIfPresent(node, "htmlContent", email.htmlContent());
      }
      case WAIT -> node.put("delayMinutes", ((Step.Wait) step).delayMinutes());
      case CONDITION -> {
        Step.Condition condition = (Step.Condition) step;
        node.put("conditionType", condition.conditionType().name());
        putIfPresent(node, "value", condition.value());
        node.set("ifTrue", encodeActions(condition.ifTrue()));
        node.set("ifFalse", encodeActions(condition.ifFalse()));
      }
      case ADD_TAG -> node.put("tagName", ((Step.AddTag) step).tagName());
      case CREATE_DISCOUNT -> {
        Step.CreateDiscount discount = (Step.CreateDiscount) step;
        putIfPresent(node, "codePrefix", discount.codePrefix());
        node.put("discountType", discount.discountType().name());
        node.put("value", discount.value());
        node.put("expiresInDays", discount.expiresInDays());
      }
    }
    return node;
  }

  private ArrayNode encodeActions(List<Step.Action> actions) {
    ArrayNode array = mapper.createArrayNode();
    for (Step.Action action : actions) {
      array.add(encode(action));
    }
    return array;
  }

  private Step decode(JsonNode node) {
    StepType type = StepType.valueOf(required(node, "type").asText());
    return switch (type) {
      case SEND_EMAIL -> new Step.SendEmail(required(node, "subject").asText(),
          text(node, "templateId"), text(node, "htmlContent"));
      case WAIT -> new Step.Wait(required(node, "delayMinutes").asLong());
      case CONDITION -> new Step.Condition(
          ConditionType.valueOf(required(node, "conditionType").asText()),
          text(node, "value"),
          decodeActions(node.get("ifTrue")),
          decodeActions(node.get("ifFalse")));
      case ADD_TAG -> new Step.AddTag(required(node, "tagName").asText());
      case CREATE_DISCOUNT -> new Step.CreateDiscount(
          text(node, "codePrefix"),
          DiscountType.valueOf(required(node, "discountType").asText()),
          new BigDecimal(required(node, "value").asText()),
          node.path("expiresInDays").asInt(0));
    };
  }

  private List<Step.Action> decodeActions(JsonNode array) {
    List<Step.Action> actions = new ArrayList<>();
    if (array == null || array.isNull()) {
      return actions;
    }
    for (JsonNode node : array) {
      Step step = decode(node);
      if (!(step instanceof Step.Action action)) {
        throw new IllegalArgumentException("Step type " + step.type() + " cannot be a branch action");
      }
      actions.add(action);
    }
    return actions;
  }

  private static JsonNode required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing step field: " + field);
    }
    return value;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }
}
