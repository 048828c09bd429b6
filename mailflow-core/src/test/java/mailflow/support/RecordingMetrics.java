package mailflow.support;

import mailflow.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts every metric call by method name.
 */
public class RecordingMetrics implements MetricsExporter {
  private final Map<String, AtomicLong> counts = new ConcurrentHashMap<>();

  public long count(String name) {
    AtomicLong n = counts.get(name);
    return n == null ? 0 : n.get();
  }

  private void add(String name, long delta) {
    counts.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(delta);
  }

  @Override
  public void incrementHotEnqueued() {
    add("hotEnqueued", 1);
  }

  @Override
  public void incrementHotDropped() {
    add("hotDropped", 1);
  }

  @Override
  public void incrementColdEnqueued() {
    add("coldEnqueued", 1);
  }

  @Override
  public void incrementSendSuccess() {
    add("sendSuccess", 1);
  }

  @Override
  public void incrementSendRetried() {
    add("sendRetried", 1);
  }

  @Override
  public void incrementSendFailed() {
    add("sendFailed", 1);
  }

  @Override
  public void incrementSendSkipped() {
    add("sendSkipped", 1);
  }

  @Override
  public void incrementClaimContended() {
    add("claimContended", 1);
  }

  @Override
  public void incrementLocksRecovered(int count) {
    add("locksRecovered", count);
  }

  @Override
  public void incrementStepProcessed() {
    add("stepProcessed", 1);
  }

  @Override
  public void incrementStepRetried() {
    add("stepRetried", 1);
  }

  @Override
  public void incrementStepDead() {
    add("stepDead", 1);
  }

  @Override
  public void recordQueueDepths(int hotDepth, int coldDepth) {
  }

  @Override
  public void recordStepLagMs(long lagMs) {
  }
}
