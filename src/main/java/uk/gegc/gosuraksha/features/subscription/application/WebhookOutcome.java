package uk.gegc.gosuraksha.features.subscription.application;

import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of processing one callback, with the account's subscription state after processing and
 * the state it replaced when an update was applied.
 */
public record WebhookOutcome(
        SubscriptionWebhookService.Result result,
        String eventId,
        String eventType,
        UUID accountId,
        PlanTier plan,
        SubscriptionStatus status,
        Instant expiresAt,
        PlanTier previousPlan,
        SubscriptionStatus previousStatus,
        Instant previousExpiresAt
) {
    public boolean idempotent() {
        return result == SubscriptionWebhookService.Result.DUPLICATE;
    }

    public static WebhookOutcome duplicate(String eventId, String eventType) {
        return new WebhookOutcome(SubscriptionWebhookService.Result.DUPLICATE, eventId, eventType,
                null, null, null, null, null, null, null);
    }

    public static WebhookOutcome unhandled(String eventId, String eventType) {
        return new WebhookOutcome(SubscriptionWebhookService.Result.UNHANDLED, eventId, eventType,
                null, null, null, null, null, null, null);
    }
}
