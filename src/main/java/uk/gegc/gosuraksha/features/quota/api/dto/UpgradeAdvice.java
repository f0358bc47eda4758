package uk.gegc.gosuraksha.features.quota.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;

import java.util.List;

public record UpgradeAdvice(
        String code,
        String message,
        String reason,
        String feature,
        @JsonProperty("current_plan") PlanTier currentPlan,
        String endpoint,
        @JsonProperty("recommended_plan") PlanTier recommendedPlan,
        List<String> benefits,
        @JsonProperty("discount_eligibility") DiscountEligibility discount
) {
}
