package uk.gegc.gosuraksha.features.quota.domain.exception;

import lombok.Getter;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.api.dto.UpgradeAdvice;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;

/**
 * A plan quota has been used up. Carries everything the 429 response needs.
 */
@Getter
public class PlanLimitExceededException extends RuntimeException {

    private final PlanTier plan;
    private final LimitType limitType;
    private final int limit;
    private final String reason;
    private final UpgradeAdvice upgrade;
    private final long retryAfterSeconds;

    public PlanLimitExceededException(PlanTier plan, LimitType limitType, int limit, String reason,
                                      UpgradeAdvice upgrade, long retryAfterSeconds) {
        super("Plan usage limit reached");
        this.plan = plan;
        this.limitType = limitType;
        this.limit = limit;
        this.reason = reason;
        this.upgrade = upgrade;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getWindow() {
        return limitType.getWindow().label();
    }
}
