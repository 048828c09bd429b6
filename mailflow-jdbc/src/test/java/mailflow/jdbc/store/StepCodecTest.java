package mailflow.jdbc.store;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import mailflow.model.ConditionType;
import mailflow.model.DiscountType;
import mailflow.model.Step;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepCodecTest {
  private final StepCodec codec = new StepCodec();

  @Test
  void decodesHandWrittenFlow() {
    String json = "[{\"type\":\"SEND_EMAIL\",\"subject\":\"Welcome\",\"templateId\":\"tpl-1\"}," +
        "{\"type\":\"WAIT\",\"delayMinutes\":60}," +
        "{\"type\":\"CONDITION\",\"conditionType\":\"HAS_PURCHASED\"," +
        "\"ifTrue\":[{\"type\":\"ADD_TAG\",\"tagName\":\"buyer\"}]," +
        "\"ifFalse\":[{\"type\":\"CREATE_DISCOUNT\",\"codePrefix\":\"COMEBACK\"," +
        "\"discountType\":\"FIXED_AMOUNT\",\"value\":\"5.50\",\"expiresInDays\":3}]}]";

    List<Step> steps = codec.fromJson(json);

    assertEquals(3, steps.size());
    assertEquals(new Step.SendEmail("Welcome", "tpl-1", null), steps.get(0));
    assertEquals(new Step.Wait(60), steps.get(1));
    Step.Condition condition = (Step.Condition) steps.get(2);
    assertEquals(ConditionType.HAS_PURCHASED, condition.conditionType());
    assertNull(condition.value());
    assertEquals(List.of(new Step.AddTag("buyer")), condition.ifTrue());
    assertEquals(List.of(new Step.CreateDiscount("COMEBACK", DiscountType.FIXED_AMOUNT,
        new BigDecimal("5.50"), 3)), condition.ifFalse());
  }

  @Test
  void encodedFormCarriesTypeTags() {
    String json = codec.toJson(List.of(new Step.AddTag("vip"), new Step.Wait(0)));

    assertEquals("[{\"type\":\"ADD_TAG\",\"tagName\":\"vip\"},{\"type\":\"WAIT\",\"delayMinutes\":0}]", json);
  }

  @Test
  void emptyOrBlankColumnMeansNoSteps() {
    assertTrue(codec.fromJson(null).isEmpty());
    assertTrue(codec.fromJson("  ").isEmpty());
    assertEquals("[]", codec.toJson(List.of()));
  }

  @Test
  void rejectsUnknownStepType() {
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson("[{\"type\":\"SEND_SMS\"}]"));
  }

  @Test
  void rejectsWaitInsideABranch() {
    String json = "[{\"type\":\"CONDITION\",\"conditionType\":\"HAS_TAG\",\"value\":\"vip\"," +
        "\"ifTrue\":[{\"type\":\"WAIT\",\"delayMinutes\":5}],\"ifFalse\":[]}]";

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> codec.fromJson(json));
    assertTrue(ex.getMessage().contains("WAIT"));
  }

  @Test
  void rejectsMalformedJsonAndMissingFields() {
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson("{not json"));
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson("{\"type\":\"WAIT\"}"));
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson("[{\"type\":\"ADD_TAG\"}]"));
  }

  @Test
  void jacksonModulesShareOneRelease() {
    assertEquals(new JsonFactory().version(), new ObjectMapper().version());
    String json = codec.toJson(List.of(new Step.Wait(5)));
    assertEquals(json, codec.toJson(codec.fromJson(json)));
  }
}
