package mailflow.model;

import java.util.Objects;

/**
 * A customer behaviour occurrence reported by the surrounding application.
 */
public record TriggerEvent(TriggerType type, String customerId, String tag, String segmentId) {

  public TriggerEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(customerId, "customerId");
  }

  public static TriggerEvent of(TriggerType type, String customerId) {
    return new TriggerEvent(type, customerId, null, null);
  }
}
