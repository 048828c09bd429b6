package mailflow.model;

/**
 * What a completed step did, as recorded in its step result.
 */
public enum StepOutcome {
  SENT,
  SKIPPED,
  WAITED,
  BRANCHED,
  TAGGED,
  DISCOUNT_ISSUED
}
