package uk.gegc.gosuraksha.features.subscription.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.subscription.application.WebhookOutcome;

import java.time.Instant;
import java.util.UUID;

/**
 * Acknowledgement returned to billing providers. Duplicate deliveries are acknowledged with
 * {@code idempotent = true} so the provider stops retrying.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAckResponse(
        String status,
        boolean idempotent,
        @JsonProperty("event_id") String eventId,
        String result,
        @JsonProperty("account_id") UUID accountId,
        PlanTier plan,
        @JsonProperty("subscription_status") SubscriptionStatus subscriptionStatus,
        @JsonProperty("subscription_expires_at") Instant subscriptionExpiresAt
) {
    public static WebhookAckResponse from(WebhookOutcome outcome) {
        return new WebhookAckResponse(
                "ok",
                outcome.idempotent(),
                outcome.eventId(),
                outcome.result().name(),
                outcome.accountId(),
                outcome.plan(),
                outcome.status(),
                outcome.expiresAt()
        );
    }

    public static WebhookAckResponse duplicate(String eventId) {
        return new WebhookAckResponse("ok", true, eventId, "DUPLICATE", null, null, null, null);
    }
}
