package mailflow.ledger;

import mailflow.dispatch.ExponentialBackoffRetryPolicy;
import mailflow.dispatch.RetryPolicy;
import mailflow.model.CampaignStats;
import mailflow.model.Recipient;
import mailflow.model.RegistrationDetail;
import mailflow.model.RegistrationResult;
import mailflow.model.SendEntry;
import mailflow.model.SendStatus;
import mailflow.spi.ConnectionProvider;
import mailflow.spi.SendLedgerStore;
import mailflow.spi.StoreException;
import mailflow.util.Transactions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Per-(campaign, recipient) send ledger giving at-most-once delivery.
 *
 * <p>Rows are registered idempotently, claimed with a single conditional update, and released
 * only by the worker that holds the lock. A lock older than {@link #lockTimeout()} is treated
 * as abandoned: the row becomes claimable again and {@link #recoverExpiredLocks()} resets it.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class SendLedger {
  private static final Logger logger = Logger.getLogger(SendLedger.class.getName());

  static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(5);
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  static final int INSERT_BATCH_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final SendLedgerStore store;
  private final Clock clock;
  private final Duration lockTimeout;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;

  private SendLedger(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be positive");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Validates, de-duplicates and inserts recipients, {@value #INSERT_BATCH_SIZE} rows per
   * round trip. Rows that already exist are counted as duplicates; a failed insert is counted
   * as an error and does not stop the batch.
   *
   * @throws IllegalArgumentException if {@code recipients} is null or empty
   */
  public RegistrationResult bulkRegister(List<Recipient> recipients) {
    if (recipients == null || recipients.isEmpty()) {
      throw new IllegalArgumentException("recipients must not be empty");
    }
    List<RegistrationDetail> details = new ArrayList<>();
    List<SendEntry> candidates = new ArrayList<>();
    Set<String> seenKeys = new HashSet<>();
    int duplicates = 0;
    int errors = 0;
    Instant now = now();

    for (Recipient recipient : recipients) {
      if (recipient == null || isBlank(recipient.campaignId()) || isBlank(recipient.email())) {
        errors++;
        details.add(new RegistrationDetail(RegistrationDetail.Kind.INVALID,
            recipient == null ? null : recipient.campaignId(),
            recipient == null ? null : recipient.email(), null,
            "campaignId and email are required"));
        continue;
      }
      String email = JobKeys.normalizeEmail(recipient.email());
      if (!EMAIL_PATTERN.matcher(email).matches()) {
        errors++;
        details.add(new RegistrationDetail(RegistrationDetail.Kind.INVALID,
            recipient.campaignId(), recipient.email(), null, "invalid email format"));
        continue;
      }
      String jobKey = JobKeys.of(recipient.campaignId(), email);
      if (!seenKeys.add(jobKey)) {
        duplicates++;
        details.add(new RegistrationDetail(RegistrationDetail.Kind.DUPLICATE_RECIPIENT,
            recipient.campaignId(), email, jobKey, "repeated in batch"));
        continue;
      }
      candidates.add(newEntry(jobKey, recipient.campaignId(), email, recipient.customerId(), now));
    }

    List<String> created = new ArrayList<>();
    if (!candidates.isEmpty()) {
      try (Connection conn = connectionProvider.getConnection()) {
        for (int from = 0; from < candidates.size(); from += INSERT_BATCH_SIZE) {
          List<SendEntry> batch = candidates.subList(from, Math.min(candidates.size(), from + INSERT_BATCH_SIZE));
          Optional<List<Boolean>> inserted = insertBatch(conn, batch);
          for (int i = 0; i < batch.size(); i++) {
            SendEntry entry = batch.get(i);
            Optional<Boolean> createdRow = inserted.isPresent()
                ? Optional.of(inserted.get().get(i))
                : insertOne(conn, entry, details);
            if (createdRow.isEmpty()) {
              errors++;
            } else if (createdRow.get()) {
              created.add(entry.jobKey());
            } else {
              duplicates++;
              details.add(new RegistrationDetail(RegistrationDetail.Kind.ALREADY_REGISTERED,
                  entry.campaignId(), entry.recipient(), entry.jobKey(), "already registered"));
            }
          }
        }
      } catch (SQLException e) {
        throw new StoreException("Failed to register recipients", e);
      }
    }
    return new RegistrationResult(created.size(), duplicates, errors, details, created);
  }

  /**
   * Writes one batch in a single transaction. A batch the store rejects is rolled back so that
   * the caller can retry it row by row.
   */
  private Optional<List<Boolean>> insertBatch(Connection conn, List<SendEntry> batch) throws SQLException {
    conn.setAutoCommit(false);
    try {
      List<Boolean> inserted = store.insertAllIfAbsent(conn, batch);
      if (inserted.size() != batch.size()) {
        throw new StoreException("Store reported " + inserted.size() + " results for " + batch.size() + " rows");
      }
      conn.commit();
      return Optional.of(inserted);
    } catch (StoreException e) {
      conn.rollback();
      logger.log(Level.WARNING, "Batch insert of " + batch.size() + " rows failed; retrying row by row", e);
      return Optional.empty();
    } finally {
      conn.setAutoCommit(true);
    }
  }

  /** @return whether the row was created, or empty when the insert failed */
  private Optional<Boolean> insertOne(Connection conn, SendEntry entry, List<RegistrationDetail> details) {
    try {
      return Optional.of(store.insertIfAbsent(conn, entry));
    } catch (StoreException e) {
      details.add(new RegistrationDetail(RegistrationDetail.Kind.WRITE_ERROR,
          entry.campaignId(), entry.recipient(), entry.jobKey(), rootMessage(e)));
      logger.log(Level.WARNING, "Failed to register jobKey=" + entry.jobKey(), e);
      return Optional.empty();
    }
  }

  /**
   * Takes exclusive processing rights on one row.
   *
   * @return the claimed row, or empty when another worker holds it or it is already finished
   */
  public Optional<SendEntry> claim(String jobKey, String workerId) {
    Objects.requireNonNull(workerId, "workerId");
    Instant now = now();
    return Transactions.inTransaction(connectionProvider, "claim " + jobKey,
        conn -> store.claim(conn, jobKey, workerId, now, now.minus(lockTimeout)));
  }

  public boolean markSending(String jobKey, String workerId) {
    return Transactions.withConnection(connectionProvider, "mark SENDING " + jobKey,
        conn -> store.markSending(conn, jobKey, workerId, now()));
  }

  /**
   * Records a successful send. A caller that lost the lock gets {@code false} and nothing changes.
   */
  public boolean markSent(String jobKey, String workerId, String externalId) {
    return Transactions.withConnection(connectionProvider, "mark SENT " + jobKey,
        conn -> store.markSent(conn, jobKey, workerId, externalId, now()));
  }

  /**
   * Releases the row after a failed attempt.
   *
   * @return {@code FAILED} if no attempts remain, {@code PENDING} if the row will be retried,
   *     or empty if the caller no longer owned it
   */
  public Optional<SendStatus> markFailed(String jobKey, String workerId, String error) {
    return Transactions.withConnection(connectionProvider, "mark FAILED " + jobKey, conn -> {
      Instant now = now();
      Optional<SendEntry> current = store.find(conn, jobKey);
      int attempts = current.map(SendEntry::attempts).orElse(1);
      Instant nextAttemptAt = now.plusMillis(retryPolicy.computeDelayMs(attempts));
      return store.markFailed(conn, jobKey, workerId, error, now, nextAttemptAt);
    });
  }

  /** Business-rule skip, for example a bounced or unsubscribed recipient. */
  public boolean markSkipped(String jobKey, String workerId, String reason) {
    return Transactions.withConnection(connectionProvider, "mark SKIPPED " + jobKey,
        conn -> store.markSkipped(conn, jobKey, workerId, reason, now()));
  }

  /**
   * Resets abandoned {@code PROCESSING} rows to {@code PENDING}.
   *
   * @return number of rows reset
   */
  public int recoverExpiredLocks() {
    Instant now = now();
    return Transactions.withConnection(connectionProvider, "recover expired locks",
        conn -> store.recoverExpiredLocks(conn, now.minus(lockTimeout), now));
  }

  /** Job keys that a worker could claim right now, oldest first. */
  public List<String> findClaimable(int limit) {
    Instant now = now();
    return Transactions.withConnection(connectionProvider, "find claimable rows",
        conn -> store.findClaimable(conn, now, now.minus(lockTimeout), limit));
  }

  public Optional<SendEntry> find(String jobKey) {
    return Transactions.withConnection(connectionProvider, "find " + jobKey,
        conn -> store.find(conn, jobKey));
  }

  public CampaignStats stats(String campaignId) {
    return Transactions.withConnection(connectionProvider, "count campaign " + campaignId,
        conn -> new CampaignStats(campaignId, store.countByStatus(conn, campaignId)));
  }

  /** Rows that exhausted their attempts, with their last error. */
  public List<SendEntry> failed(String campaignId, int limit) {
    return Transactions.withConnection(connectionProvider, "query failed rows",
        conn -> store.findFailed(conn, campaignId, limit));
  }

  /** Gives a {@code FAILED} row a fresh attempt budget. */
  public boolean retryFailed(String jobKey) {
    return Transactions.withConnection(connectionProvider, "retry " + jobKey,
        conn -> store.resetFailed(conn, jobKey, now()) > 0);
  }

  public int retryAllFailed(String campaignId) {
    int reset = Transactions.withConnection(connectionProvider, "retry campaign " + campaignId,
        conn -> store.resetAllFailed(conn, campaignId, now()));
    if (reset > 0) {
      logger.log(Level.INFO, "Reset {0} failed rows of campaign {1}", new Object[]{reset, campaignId});
    }
    return reset;
  }

  public Duration lockTimeout() {
    return lockTimeout;
  }

  private SendEntry newEntry(String jobKey, String campaignId, String email, String customerId, Instant now) {
    return new SendEntry(jobKey, campaignId, email, customerId, SendStatus.PENDING,
        null, null, 0L, 0, maxAttempts, null, null, now, null, null, null, null, now, now);
  }

  // Stored timestamps may drop sub-millisecond precision
  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private static String rootMessage(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }

  /** Builder for {@link SendLedger}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SendLedgerStore store;
    private Clock clock;
    private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private RetryPolicy retryPolicy;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(SendLedgerStore store) {
      this.store = store;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to 5 minutes. Must be positive. */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /** Attempt budget stamped on newly registered rows. Optional. Defaults to 3. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Backoff applied between attempts of one row. Optional. Defaults to
     * {@link ExponentialBackoffRetryPolicy} with a 2 second base.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public SendLedger build() {
      return new SendLedger(this);
    }
  }
}
