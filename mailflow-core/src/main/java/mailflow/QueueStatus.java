package mailflow;

/**
 * Point-in-time view of a worker queue, for health checks and dashboards.
 *
 * @param name      queue name
 * @param available {@code false} when the queue was never started or is already closed
 * @param paused    whether workers are holding off new work
 * @param queued    items waiting locally, or due in the database for the step queue
 * @param inFlight  items being processed right now
 * @param workers   size of the worker pool
 */
public record QueueStatus(String name, boolean available, boolean paused, int queued, int inFlight, int workers) {

  public static QueueStatus unavailable(String name) {
    return new QueueStatus(name, false, false, 0, 0, 0);
  }
}
