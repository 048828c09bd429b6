package mailflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties bound from {@code mailflow.*}.
 *
 * @see MailflowAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailflow")
public class MailflowProperties {

  /**
   * Whether to create the runtime at all.
   */
  private boolean enabled = true;

  /**
   * Whether to start the send poller, lock sweeper and step scheduler with the context.
   */
  private boolean autoStart = true;

  /**
   * Lock owner prefix for this instance. A random id is used when blank.
   */
  private String workerId = "";

  /**
   * How long a send row or step signal stays locked before another instance may take it.
   */
  private Duration lockTimeout = Duration.ofMinutes(5);

  /**
   * Attempts per send and per step signal.
   */
  private int maxAttempts = 3;

  private final Dispatcher dispatcher = new Dispatcher();
  private final Retry retry = new Retry();
  private final Poller poller = new Poller();
  private final Sweeper sweeper = new Sweeper();
  private final Steps steps = new Steps();
  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public String getWorkerId() {
    return workerId;
  }

  public void setWorkerId(String workerId) {
    this.workerId = workerId;
  }

  public Duration getLockTimeout() {
    return lockTimeout;
  }

  public void setLockTimeout(Duration lockTimeout) {
    this.lockTimeout = lockTimeout;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Retry getRetry() {
    return retry;
  }

  public Poller getPoller() {
    return poller;
  }

  public Sweeper getSweeper() {
    return sweeper;
  }

  public Steps getSteps() {
    return steps;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Dispatcher {
    private int workerCount = 5;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private long drainTimeoutMs = 5000;

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getHotQueueCapacity() {
      return hotQueueCapacity;
    }

    public void setHotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
    }

    public int getColdQueueCapacity() {
      return coldQueueCapacity;
    }

    public void setColdQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }
  }

  public static class Retry {
    private long baseDelayMs = 2000;
    private long maxDelayMs = 300000;
    private boolean jitter = false;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public boolean isJitter() {
      return jitter;
    }

    public void setJitter(boolean jitter) {
      this.jitter = jitter;
    }
  }

  public static class Poller {
    private long intervalMs = 5000;
    private int batchSize = 100;

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }
  }

  public static class Sweeper {
    private long intervalSeconds = 60;

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Steps {
    private long intervalMs = 1000;
    private int batchSize = 50;
    private int workerCount = 5;

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "mailflow";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
