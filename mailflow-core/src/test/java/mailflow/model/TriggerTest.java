package mailflow.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TriggerTest {

  @Test
  void typeMustMatch() {
    assertFalse(Trigger.of(TriggerType.ORDER_PLACED).matches(TriggerEvent.of(TriggerType.CART_ABANDONED, "c1")));
    assertTrue(Trigger.of(TriggerType.ORDER_PLACED).matches(TriggerEvent.of(TriggerType.ORDER_PLACED, "c1")));
  }

  @Test
  void segmentTriggerNarrowsBySegment() {
    Trigger trigger = new Trigger(TriggerType.SEGMENT_ENTRY, null, "seg-1");

    assertTrue(trigger.matches(new TriggerEvent(TriggerType.SEGMENT_ENTRY, "c1", null, "seg-1")));
    assertFalse(trigger.matches(new TriggerEvent(TriggerType.SEGMENT_ENTRY, "c1", null, "seg-2")));
  }

  @Test
  void tagTriggerWithoutTagMatchesAnyTag() {
    Trigger trigger = Trigger.of(TriggerType.CUSTOMER_TAG_ADDED);

    assertTrue(trigger.matches(new TriggerEvent(TriggerType.CUSTOMER_TAG_ADDED, "c1", "anything", null)));
  }
}
