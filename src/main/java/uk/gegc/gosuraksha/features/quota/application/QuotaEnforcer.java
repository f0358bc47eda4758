package uk.gegc.gosuraksha.features.quota.application;

import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;

public interface QuotaEnforcer {

    /**
     * Consumes one unit of {@code limitType} for {@code account}, or throws
     * {@link uk.gegc.gosuraksha.features.quota.domain.exception.PlanLimitExceededException}.
     * Counter store failures propagate as
     * {@link uk.gegc.gosuraksha.features.ratelimit.domain.exception.CounterStoreUnavailableException}.
     *
     * @param endpoint request path recorded with a denial
     */
    void enforce(Account account, LimitType limitType, String endpoint);
}
