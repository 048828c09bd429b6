package mailflow.dispatch;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed {@link InFlightTracker}. Thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  @Override
  public boolean tryAcquire(String jobKey) {
    return inFlight.add(jobKey);
  }

  @Override
  public void release(String jobKey) {
    inFlight.remove(jobKey);
  }

  public int size() {
    return inFlight.size();
  }
}
