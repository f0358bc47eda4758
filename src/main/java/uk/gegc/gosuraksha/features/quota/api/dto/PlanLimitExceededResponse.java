package uk.gegc.gosuraksha.features.quota.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;

/**
 * 429 body for quota denials: {@code {"error": {"code": "PLAN_LIMIT_EXCEEDED", ...}}}.
 */
public record PlanLimitExceededResponse(Body error) {

    public record Body(
            String code,
            String message,
            PlanTier plan,
            @JsonProperty("limit_type") LimitType limitType,
            String window,
            int limit,
            UpgradeAdvice upgrade
    ) {
    }
}
