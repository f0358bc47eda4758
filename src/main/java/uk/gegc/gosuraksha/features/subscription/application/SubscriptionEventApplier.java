package uk.gegc.gosuraksha.features.subscription.application;

import uk.gegc.gosuraksha.features.subscription.domain.model.CanonicalSubscriptionEvent;

/**
 * Applies a validated canonical event in one transaction: account row lock, ledger insert and
 * account mutation commit or roll back together.
 */
public interface SubscriptionEventApplier {

    WebhookOutcome apply(CanonicalSubscriptionEvent event);
}
