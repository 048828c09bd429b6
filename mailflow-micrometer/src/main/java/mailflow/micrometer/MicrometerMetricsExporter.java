package mailflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import mailflow.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsExporter} backed by a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mailflow.enqueue.hot}, {@code mailflow.enqueue.hot.dropped}, {@code mailflow.enqueue.cold}</li>
 *   <li>{@code mailflow.send.sent}, {@code mailflow.send.retried}, {@code mailflow.send.failed},
 *       {@code mailflow.send.skipped}, {@code mailflow.send.contended}</li>
 *   <li>{@code mailflow.locks.recovered}</li>
 *   <li>{@code mailflow.step.processed}, {@code mailflow.step.retried}, {@code mailflow.step.dead}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code mailflow.queue.hot.depth}, {@code mailflow.queue.cold.depth}</li>
 *   <li>{@code mailflow.step.lag.oldest.ms}: lateness of the oldest signal in the last scheduler cycle</li>
 * </ul>
 *
 * <p>{@link #close()} removes every meter; {@link mailflow.Mailflow#close()} calls it.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter hotEnqueued;
  private final Counter hotDropped;
  private final Counter coldEnqueued;
  private final Counter sendSent;
  private final Counter sendRetried;
  private final Counter sendFailed;
  private final Counter sendSkipped;
  private final Counter sendContended;
  private final Counter locksRecovered;
  private final Counter stepProcessed;
  private final Counter stepRetried;
  private final Counter stepDead;
  private final Gauge hotDepthGauge;
  private final Gauge coldDepthGauge;
  private final Gauge stepLagGauge;

  private final AtomicInteger hotDepth = new AtomicInteger();
  private final AtomicInteger coldDepth = new AtomicInteger();
  private final AtomicLong stepLagMs = new AtomicLong();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "mailflow");
  }

  /**
   * @param namePrefix prefix for every meter name, e.g. {@code "shop.mailflow"} when several
   *                   runtimes share a registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.hotEnqueued = counter(namePrefix + ".enqueue.hot", "Job keys accepted by the hot queue");
    this.hotDropped = counter(namePrefix + ".enqueue.hot.dropped", "Job keys dropped (hot queue full)");
    this.coldEnqueued = counter(namePrefix + ".enqueue.cold", "Job keys enqueued by the poller");
    this.sendSent = counter(namePrefix + ".send.sent", "Ledger entries sent");
    this.sendRetried = counter(namePrefix + ".send.retried", "Failed sends scheduled for retry");
    this.sendFailed = counter(namePrefix + ".send.failed", "Sends failed with no attempts left");
    this.sendSkipped = counter(namePrefix + ".send.skipped", "Sends skipped for suppressed recipients");
    this.sendContended = counter(namePrefix + ".send.contended", "Claims lost to another worker");
    this.locksRecovered = counter(namePrefix + ".locks.recovered", "Expired send locks released");
    this.stepProcessed = counter(namePrefix + ".step.processed", "Step signals processed");
    this.stepRetried = counter(namePrefix + ".step.retried", "Step signals scheduled for retry");
    this.stepDead = counter(namePrefix + ".step.dead", "Step signals moved to DEAD");

    this.hotDepthGauge = Gauge.builder(namePrefix + ".queue.hot.depth", hotDepth, AtomicInteger::get)
        .register(registry);
    this.coldDepthGauge = Gauge.builder(namePrefix + ".queue.cold.depth", coldDepth, AtomicInteger::get)
        .register(registry);
    this.stepLagGauge = Gauge.builder(namePrefix + ".step.lag.oldest.ms", stepLagMs, AtomicLong::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementHotEnqueued() {
    if (closed) return;
    hotEnqueued.increment();
  }

  @Override
  public void incrementHotDropped() {
    if (closed) return;
    hotDropped.increment();
  }

  @Override
  public void incrementColdEnqueued() {
    if (closed) return;
    coldEnqueued.increment();
  }

  @Override
  public void incrementSendSuccess() {
    if (closed) return;
    sendSent.increment();
  }

  @Override
  public void incrementSendRetried() {
    if (closed) return;
    sendRetried.increment();
  }

  @Override
  public void incrementSendFailed() {
    if (closed) return;
    sendFailed.increment();
  }

  @Override
  public void incrementSendSkipped() {
    if (closed) return;
    sendSkipped.increment();
  }

  @Override
  public void incrementClaimContended() {
    if (closed) return;
    sendContended.increment();
  }

  @Override
  public void incrementLocksRecovered(int count) {
    if (closed || count <= 0) return;
    locksRecovered.increment(count);
  }

  @Override
  public void incrementStepProcessed() {
    if (closed) return;
    stepProcessed.increment();
  }

  @Override
  public void incrementStepRetried() {
    if (closed) return;
    stepRetried.increment();
  }

  @Override
  public void incrementStepDead() {
    if (closed) return;
    stepDead.increment();
  }

  @Override
  public void recordQueueDepths(int hotDepth, int coldDepth) {
    if (closed) return;
    this.hotDepth.set(hotDepth);
    this.coldDepth.set(coldDepth);
  }

  @Override
  public void recordStepLagMs(long lagMs) {
    if (closed) return;
    this.stepLagMs.set(lagMs);
  }

  /** Removes every meter this exporter registered. Later calls are ignored. */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(hotEnqueued, hotDropped, coldEnqueued,
        sendSent, sendRetried, sendFailed, sendSkipped, sendContended, locksRecovered,
        stepProcessed, stepRetried, stepDead,
        hotDepthGauge, coldDepthGauge, stepLagGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
