package mailflow.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-status row counts of one campaign in the send ledger.
 */
public record CampaignStats(String campaignId, Map<SendStatus, Long> counts) {

  public CampaignStats {
    EnumMap<SendStatus, Long> copy = new EnumMap<>(SendStatus.class);
    for (SendStatus status : SendStatus.values()) {
      copy.put(status, 0L);
    }
    copy.putAll(counts);
    counts = Collections.unmodifiableMap(copy);
  }

  public long count(SendStatus status) {
    return counts.get(status);
  }

  public long total() {
    long total = 0;
    for (long n : counts.values()) {
      total += n;
    }
    return total;
  }
}
