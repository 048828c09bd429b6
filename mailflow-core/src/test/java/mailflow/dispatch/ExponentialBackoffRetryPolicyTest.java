package mailflow.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void defaultsDoubleFromTwoSeconds() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(2_000, policy.computeDelayMs(1));
    assertEquals(4_000, policy.computeDelayMs(2));
    assertEquals(8_000, policy.computeDelayMs(3));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    assertEquals(500, policy.computeDelayMs(10));
    assertEquals(500, policy.computeDelayMs(40));
    assertEquals(500, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void zeroAttemptsMeansNoDelay() {
    assertEquals(0, new ExponentialBackoffRetryPolicy().computeDelayMs(0));
  }

  @Test
  void jitterStaysWithinHalfAndOneAndAHalf() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 100000, true);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 500 && delay < 1500, "delay out of range: " + delay);
    }
  }

  @Test
  void rejectsNonPositiveBase() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
  }

  @Test
  void rejectsMaxBelowBase() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 10));
  }
}
