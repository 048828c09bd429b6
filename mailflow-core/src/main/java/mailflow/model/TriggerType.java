package mailflow.model;

/**
 * Customer behaviour that can start a flow.
 */
public enum TriggerType {
  CUSTOMER_CREATED,
  ORDER_PLACED,
  CART_ABANDONED,
  POPUP_SIGNUP,
  CUSTOMER_TAG_ADDED,
  SEGMENT_ENTRY,
  CUSTOM_EVENT,
  ORDER_FULFILLED,
  ORDER_CANCELLED,
  ORDER_REFUNDED,
  PRODUCT_BACK_IN_STOCK
}
