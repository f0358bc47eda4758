package uk.gegc.gosuraksha.features.quota.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscountEligibility(
        boolean eligible,
        @JsonProperty("window_days") int windowDays,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("days_remaining") Long daysRemaining,
        String reason
) {
    public static DiscountEligibility ineligible(int windowDays, String reason) {
        return new DiscountEligibility(false, windowDays, null, null, reason);
    }
}
