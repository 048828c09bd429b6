package mailflow.scheduler;

import mailflow.model.StepSignal;

/**
 * Processes one step signal delivered by the {@link StepScheduler}.
 *
 * <p>Returning normally acknowledges the signal. Throwing {@link InvalidSignalException}
 * dead-letters it at once; any other exception schedules a retry until the attempt budget is
 * spent.
 */
@FunctionalInterface
public interface StepHandler {

  /**
   * @param signal      the delivered signal
   * @param lastAttempt {@code true} when a failure now will not be retried
   */
  void handle(StepSignal signal, boolean lastAttempt) throws Exception;
}
