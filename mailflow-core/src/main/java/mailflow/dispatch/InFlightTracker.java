package mailflow.dispatch;

/**
 * In-process guard against two local workers picking up the same job key at once. Only an
 * optimisation: the ledger claim is what decides ownership.
 */
public interface InFlightTracker {
  boolean tryAcquire(String jobKey);

  void release(String jobKey);
}
