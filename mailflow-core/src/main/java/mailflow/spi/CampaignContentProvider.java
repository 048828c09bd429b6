package mailflow.spi;

import mailflow.model.SendEntry;

/**
 * Resolves the campaign message for a claimed ledger entry.
 */
@FunctionalInterface
public interface CampaignContentProvider {

  MessageContent contentFor(SendEntry entry);
}
