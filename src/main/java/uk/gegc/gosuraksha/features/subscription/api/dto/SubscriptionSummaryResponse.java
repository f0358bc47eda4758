package uk.gegc.gosuraksha.features.subscription.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.quota.api.dto.DiscountEligibility;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.quota.domain.model.PlanLimit;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

@Schema(name = "SubscriptionSummaryResponse", description = "Effective plan and entitlements of the current account")
public record SubscriptionSummaryResponse(
        @Schema(description = "Plan after lapsed subscriptions are downgraded") PlanTier plan,
        @JsonProperty("subscription_status") SubscriptionStatus subscriptionStatus,
        @JsonProperty("subscription_expires_at") Instant subscriptionExpiresAt,
        @JsonProperty("first_upgrade_used") boolean firstUpgradeUsed,
        Set<Feature> features,
        @Schema(description = "Plan limits; null means unlimited") Map<PlanLimit, Integer> limits,
        @JsonProperty("ai_image_lifetime_used") int aiImageLifetimeUsed,
        DiscountEligibility discount
) {
}
