package uk.gegc.gosuraksha.features.subscription.domain.model;

import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;

import java.time.Instant;

/**
 * Provider-neutral view of a billing callback.
 *
 * @param accountRef raw subject reference from the payload; resolved to an account id when applied
 * @param plan       derived plan, or null for status-only events that keep the current plan and expiry
 * @param eventAt    provider-declared event time, falling back to receipt time
 * @param payload    raw payload snapshot stored on the ledger row
 */
public record CanonicalSubscriptionEvent(
        String provider,
        String eventId,
        String eventType,
        String accountRef,
        PlanTier plan,
        SubscriptionStatus status,
        Instant expiresAt,
        Instant eventAt,
        String payload
) {
    public boolean keepsCurrentPlan() {
        return plan == null;
    }
}
