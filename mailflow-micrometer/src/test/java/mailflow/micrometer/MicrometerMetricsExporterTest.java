package mailflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void enqueueCounters() {
    exporter.incrementHotEnqueued();
    exporter.incrementHotEnqueued();
    exporter.incrementHotDropped();
    exporter.incrementColdEnqueued();

    assertEquals(2.0, counter("mailflow.enqueue.hot").count());
    assertEquals(1.0, counter("mailflow.enqueue.hot.dropped").count());
    assertEquals(1.0, counter("mailflow.enqueue.cold").count());
  }

  @Test
  void sendOutcomeCounters() {
    exporter.incrementSendSuccess();
    exporter.incrementSendSuccess();
    exporter.incrementSendRetried();
    exporter.incrementSendFailed();
    exporter.incrementSendSkipped();
    exporter.incrementClaimContended();

    assertEquals(2.0, counter("mailflow.send.sent").count());
    assertEquals(1.0, counter("mailflow.send.retried").count());
    assertEquals(1.0, counter("mailflow.send.failed").count());
    assertEquals(1.0, counter("mailflow.send.skipped").count());
    assertEquals(1.0, counter("mailflow.send.contended").count());
  }

  @Test
  void recoveredLocksAddTheBatchSize() {
    exporter.incrementLocksRecovered(3);
    exporter.incrementLocksRecovered(0);
    exporter.incrementLocksRecovered(2);

    assertEquals(5.0, counter("mailflow.locks.recovered").count());
  }

  @Test
  void stepCounters() {
    exporter.incrementStepProcessed();
    exporter.incrementStepRetried();
    exporter.incrementStepRetried();
    exporter.incrementStepDead();

    assertEquals(1.0, counter("mailflow.step.processed").count());
    assertEquals(2.0, counter("mailflow.step.retried").count());
    assertEquals(1.0, counter("mailflow.step.dead").count());
  }

  @Test
  void gaugesFollowTheLastRecordedValue() {
    exporter.recordQueueDepths(42, 7);
    exporter.recordStepLagMs(1500L);
    assertEquals(42.0, gauge("mailflow.queue.hot.depth").value());
    assertEquals(7.0, gauge("mailflow.queue.cold.depth").value());
    assertEquals(1500.0, gauge("mailflow.step.lag.oldest.ms").value());

    exporter.recordQueueDepths(0, 0);
    exporter.recordStepLagMs(0L);
    assertEquals(0.0, gauge("mailflow.queue.hot.depth").value());
    assertEquals(0.0, gauge("mailflow.step.lag.oldest.ms").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "shop.mailflow");
    custom.incrementSendSuccess();
    custom.recordQueueDepths(10, 5);

    assertEquals(1.0, counter("shop.mailflow.send.sent").count());
    assertEquals(10.0, gauge("shop.mailflow.queue.hot.depth").value());
    assertEquals(0.0, counter("mailflow.send.sent").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.incrementSendSuccess();
    exporter.close();

    assertNull(registry.find("mailflow.send.sent").counter());
    assertNull(registry.find("mailflow.queue.hot.depth").gauge());
    assertNull(registry.find("mailflow.step.lag.oldest.ms").gauge());
    assertDoesNotThrow(() -> exporter.incrementSendSuccess());
    assertDoesNotThrow(() -> exporter.recordQueueDepths(1, 1));
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "mailflow."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
