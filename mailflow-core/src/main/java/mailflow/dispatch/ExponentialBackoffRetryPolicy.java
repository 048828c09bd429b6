package mailflow.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}, with optional jitter in
 * [0.5, 1.5).
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 2_000;
  public static final long DEFAULT_MAX_DELAY_MS = 300_000;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, false);
  }

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, false);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   * @param jitter      whether to spread delays randomly around the computed value
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay;
    if (attempts >= 31) {
      delay = maxDelayMs;
    } else {
      long factor = 1L << (attempts - 1);
      // Overflow guard
      delay = factor > maxDelayMs / baseDelayMs ? maxDelayMs : Math.min(maxDelayMs, baseDelayMs * factor);
    }
    if (!jitter) {
      return delay;
    }
    long spread = (long) (delay * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, spread));
  }
}
