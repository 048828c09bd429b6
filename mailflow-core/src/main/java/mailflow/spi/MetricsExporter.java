package mailflow.spi;

/**
 * Observability hook for exporting dispatch and flow counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /** A job key was accepted by the hot queue right after registration. */
  void incrementHotEnqueued();

  /** A job key was dropped because the hot queue was full; the poller picks it up later. */
  void incrementHotDropped();

  /** A job key was handed to the cold queue by the poller. */
  void incrementColdEnqueued();

  /** A ledger entry reached {@code SENT}. */
  void incrementSendSuccess();

  /** A send attempt failed and the entry went back to {@code PENDING}. */
  void incrementSendRetried();

  /** A send attempt failed with no attempts left. */
  void incrementSendFailed();

  /** A send was skipped because the recipient is suppressed. */
  void incrementSendSkipped();

  /** A claim found the row held by another worker or already finished. */
  void incrementClaimContended();

  void incrementLocksRecovered(int count);

  void incrementStepProcessed();

  void incrementStepRetried();

  void incrementStepDead();

  /**
   * Records the current depth of both dispatch queues.
   *
   * @param hotDepth  number of job keys in the hot queue
   * @param coldDepth number of job keys in the cold queue
   */
  void recordQueueDepths(int hotDepth, int coldDepth);

  /**
   * Records how late the oldest signal of the last scheduler cycle was.
   *
   * @param lagMs lag in milliseconds (always non-negative)
   */
  void recordStepLagMs(long lagMs);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementHotEnqueued() {
    }

    @Override
    public void incrementHotDropped() {
    }

    @Override
    public void incrementColdEnqueued() {
    }

    @Override
    public void incrementSendSuccess() {
    }

    @Override
    public void incrementSendRetried() {
    }

    @Override
    public void incrementSendFailed() {
    }

    @Override
    public void incrementSendSkipped() {
    }

    @Override
    public void incrementClaimContended() {
    }

    @Override
    public void incrementLocksRecovered(int count) {
    }

    @Override
    public void incrementStepProcessed() {
    }

    @Override
    public void incrementStepRetried() {
    }

    @Override
    public void incrementStepDead() {
    }

    @Override
    public void recordQueueDepths(int hotDepth, int coldDepth) {
    }

    @Override
    public void recordStepLagMs(long lagMs) {
    }
  }
}
