package mailflow.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultInFlightTrackerTest {

  @Test
  void secondAcquireOfSameKeyFailsUntilReleased() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();

    assertTrue(tracker.tryAcquire("k1"));
    assertFalse(tracker.tryAcquire("k1"));
    assertTrue(tracker.tryAcquire("k2"));
    assertEquals(2, tracker.size());

    tracker.release("k1");
    assertTrue(tracker.tryAcquire("k1"));
  }
}
