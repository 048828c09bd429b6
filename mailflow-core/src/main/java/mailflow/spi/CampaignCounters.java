package mailflow.spi;

import mailflow.model.SendStatus;

/**
 * Campaign aggregate counters owned by the surrounding application. Notified once per ledger
 * entry that reaches a terminal status.
 */
@FunctionalInterface
public interface CampaignCounters {

  CampaignCounters NOOP = (campaignId, status) -> {
  };

  void recordOutcome(String campaignId, SendStatus status);
}
