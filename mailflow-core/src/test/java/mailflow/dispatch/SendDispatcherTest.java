package mailflow.dispatch;

import mailflow.QueueStatus;
import mailflow.ledger.SendLedger;
import mailflow.model.Recipient;
import mailflow.model.SendStatus;
import mailflow.spi.MessageContent;
import mailflow.support.InMemorySendLedgerStore;
import mailflow.support.MutableClock;
import mailflow.support.RecordingDeliveryProvider;
import mailflow.support.RecordingMetrics;
import mailflow.support.StubConnections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SendDispatcherTest {

  private SendLedger ledger;
  private RecordingDeliveryProvider provider;
  private final Map<SendStatus, AtomicInteger> outcomes = new ConcurrentHashMap<>();
  private SendDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    ledger = SendLedger.builder()
        .connectionProvider(StubConnections.noop())
        .store(new InMemorySendLedgerStore())
        .build();
    provider = new RecordingDeliveryProvider();
  }

  @AfterEach
  void tearDown() {
    if (dispatcher != null) {
      dispatcher.close();
    }
  }

  @Test
  void builderRejectsMissingDeliveryProvider() {
    assertThrows(NullPointerException.class, () -> SendDispatcher.builder()
        .ledger(ledger)
        .contentProvider(entry -> content())
        .build());
  }

  @Test
  void builderRejectsZeroQueueCapacity() {
    assertThrows(IllegalArgumentException.class, () -> builder().hotQueueCapacity(0).build());
  }

  @Test
  void processSendsAndMarksSent() {
    dispatcher = builder().workerCount(0).build();
    String key = register("a@x.com");

    Optional<SendStatus> result = dispatcher.process(key, "w1");

    assertEquals(Optional.of(SendStatus.SENT), result);
    assertEquals(1, provider.sent().size());
    assertEquals("a@x.com", provider.sent().get(0).recipient());
    assertEquals(SendStatus.SENT, ledger.find(key).orElseThrow().status());
    assertEquals(1, outcomes.get(SendStatus.SENT).get());
  }

  @Test
  void secondProcessOfSameKeyDoesNotSendAgain() {
    dispatcher = builder().workerCount(0).build();
    String key = register("a@x.com");

    dispatcher.process(key, "w1");
    Optional<SendStatus> again = dispatcher.process(key, "w2");

    assertTrue(again.isEmpty());
    assertEquals(1, provider.calls());
  }

  @Test
  void suppressedRecipientIsSkippedWithoutSending() {
    dispatcher = builder().workerCount(0).suppressionList(r -> r.startsWith("bounced")).build();
    String key = register("bounced@x.com");

    assertEquals(Optional.of(SendStatus.SKIPPED), dispatcher.process(key, "w1"));
    assertEquals(0, provider.calls());
    assertEquals(SendStatus.SKIPPED, ledger.find(key).orElseThrow().status());
    assertEquals(1, outcomes.get(SendStatus.SKIPPED).get());
  }

  @Test
  void providerFailureLeavesRowPendingForRetry() {
    dispatcher = builder().workerCount(0).build();
    String key = register("a@x.com");
    provider.failNext(1);

    assertEquals(Optional.of(SendStatus.PENDING), dispatcher.process(key, "w1"));
    assertEquals(SendStatus.PENDING, ledger.find(key).orElseThrow().status());
    assertNotNull(ledger.find(key).orElseThrow().lastError());
    assertNull(outcomes.get(SendStatus.FAILED));
  }

  @Test
  void contentProviderFailureCountsAsAttempt() {
    dispatcher = SendDispatcher.builder()
        .ledger(ledger)
        .deliveryProvider(provider)
        .contentProvider(entry -> {
          throw new IllegalStateException("template missing");
        })
        .workerCount(0)
        .build();
    String key = register("a@x.com");

    assertEquals(Optional.of(SendStatus.PENDING), dispatcher.process(key, "w1"));
    assertEquals("template missing", ledger.find(key).orElseThrow().lastError());
  }

  @Test
  void workerThatLostItsLockDoesNotSend() {
    MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    ledger = clockedLedger(clock);
    RecordingMetrics metrics = new RecordingMetrics();
    String key = register("a@x.com");
    dispatcher = builder()
        .workerCount(0)
        .metrics(metrics)
        .suppressionList(recipient -> {
          clock.advance(Duration.ofMinutes(6));
          assertTrue(ledger.claim(key, "w2").isPresent());
          return false;
        })
        .build();

    Optional<SendStatus> result = dispatcher.process(key, "w1");

    assertTrue(result.isEmpty());
    assertEquals(0, provider.calls());
    assertEquals(SendStatus.PROCESSING, ledger.find(key).orElseThrow().status());
    assertEquals("w2", ledger.find(key).orElseThrow().lockedBy());
    assertEquals(1, metrics.count("claimContended"));
    assertTrue(outcomes.isEmpty());
  }

  @Test
  void failureAfterLockLossLeavesNewOwnerInCharge() {
    MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    ledger = clockedLedger(clock);
    String key = register("a@x.com");
    dispatcher = SendDispatcher.builder()
        .ledger(ledger)
        .deliveryProvider(provider)
        .contentProvider(entry -> {
          clock.advance(Duration.ofMinutes(6));
          ledger.claim(key, "w2").orElseThrow();
          throw new IllegalStateException("template missing");
        })
        .workerCount(0)
        .build();

    assertTrue(dispatcher.process(key, "w1").isEmpty());
    assertEquals(0, provider.calls());
    assertEquals("w2", ledger.find(key).orElseThrow().lockedBy());
    assertNull(ledger.find(key).orElseThrow().lastError());
  }

  @Test
  void hotSubmissionIsDeliveredByWorkers() throws Exception {
    dispatcher = builder().workerCount(2).build();
    List<String> keys = List.of(register("a@x.com"), register("b@x.com"), register("c@x.com"));

    for (String key : keys) {
      assertTrue(dispatcher.submit(key));
    }

    awaitSent(keys, 3_000);
    assertEquals(3, provider.sent().size());
  }

  @Test
  void fullHotQueueRejectsSubmission() {
    dispatcher = builder().workerCount(0).hotQueueCapacity(1).build();

    assertTrue(dispatcher.submit("k1"));
    assertFalse(dispatcher.submit("k2"));
  }

  @Test
  void statusReflectsPauseAndClose() {
    dispatcher = builder().workerCount(0).build();
    dispatcher.submit("k1");
    dispatcher.pause();

    QueueStatus status = dispatcher.status();
    assertTrue(status.available());
    assertTrue(status.paused());
    assertEquals(1, status.queued());

    dispatcher.close();
    assertFalse(dispatcher.status().available());
    assertFalse(dispatcher.submit("k2"));
  }

  private SendDispatcher.Builder builder() {
    return SendDispatcher.builder()
        .ledger(ledger)
        .deliveryProvider(provider)
        .contentProvider(entry -> content())
        .campaignCounters((campaignId, status) ->
            outcomes.computeIfAbsent(status, s -> new AtomicInteger()).incrementAndGet());
  }

  private static SendLedger clockedLedger(MutableClock clock) {
    return SendLedger.builder()
        .connectionProvider(StubConnections.noop())
        .store(new InMemorySendLedgerStore())
        .clock(clock)
        .build();
  }

  private static MessageContent content() {
    return new MessageContent("Hello", null, "<p>Hi</p>", Map.of());
  }

  private String register(String email) {
    return ledger.bulkRegister(List.of(Recipient.of("c1", email))).createdKeys().get(0);
  }

  private void awaitSent(List<String> keys, long timeoutMs) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMs;
    while (System.currentTimeMillis() < deadline) {
      if (keys.stream().allMatch(k -> ledger.find(k).orElseThrow().status() == SendStatus.SENT)) {
        return;
      }
      Thread.sleep(20);
    }
    for (String key : keys) {
      assertEquals(SendStatus.SENT, ledger.find(key).orElseThrow().status());
    }
  }
}
