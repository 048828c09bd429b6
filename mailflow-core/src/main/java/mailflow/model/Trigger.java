package mailflow.model;

import java.util.Objects;

/**
 * What starts a flow. {@code tagName} narrows {@link TriggerType#CUSTOMER_TAG_ADDED} and
 * {@code segmentId} narrows {@link TriggerType#SEGMENT_ENTRY}; both are optional.
 */
public record Trigger(TriggerType type, String tagName, String segmentId) {

  public Trigger {
    Objects.requireNonNull(type, "type");
  }

  public static Trigger of(TriggerType type) {
    return new Trigger(type, null, null);
  }

  public boolean matches(TriggerEvent event) {
    if (event.type() != type) {
      return false;
    }
    if (type == TriggerType.CUSTOMER_TAG_ADDED && tagName != null
        && !tagName.equals(event.tag())) {
      return false;
    }
    return type != TriggerType.SEGMENT_ENTRY || segmentId == null
        || segmentId.equals(event.segmentId());
  }
}
