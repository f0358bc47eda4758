package uk.gegc.gosuraksha.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.application.LifetimeUsageGuard;
import uk.gegc.gosuraksha.features.quota.application.PlanLimitBreachHandler;
import uk.gegc.gosuraksha.features.quota.application.PlanPolicy;
import uk.gegc.gosuraksha.features.quota.application.QuotaEnforcer;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitPrimitives;
import uk.gegc.gosuraksha.features.ratelimit.domain.model.LimitWindow;
import uk.gegc.gosuraksha.features.subscription.application.LazyDowngradeResolver;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;

import java.util.OptionalInt;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaEnforcerImpl implements QuotaEnforcer {

    private final PlanPolicy planPolicy;
    private final RateLimitPrimitives primitives;
    private final LifetimeUsageGuard lifetimeUsageGuard;
    private final PlanLimitBreachHandler breachHandler;
    private final LazyDowngradeResolver lazyDowngradeResolver;
    private final UsageMetricsService metricsService;

    @Override
    public void enforce(Account account, LimitType limitType, String endpoint) {
        PlanTier plan = lazyDowngradeResolver.effectivePlan(account);
        if (planPolicy.isExemptFromMeteredLimits(plan)) {
            return;
        }

        OptionalInt ceiling = planPolicy.limitFor(plan, limitType.getPlanLimit());
        if (ceiling.isEmpty()) {
            return;
        }
        int limit = ceiling.getAsInt();

        if (breachHandler.isCoolingDown(account, limitType)) {
            metricsService.incrementCooldownShortCircuit(limitType.name());
            throw breachHandler.breach(account, plan, limitType, limit, endpoint,
                    PlanLimitBreachHandler.REASON_COOLDOWN, false);
        }

        if (limitType.getWindow() == LimitWindow.LIFETIME) {
            lifetimeUsageGuard.consumeLifetime(account, limit, endpoint);
        } else {
            boolean allowed = primitives.fixedBucketIncrement(
                    limitType.getNamespace(), limitType.getWindow(), limit, account.getId().toString());
            if (!allowed) {
                throw breachHandler.breach(account, plan, limitType, limit, endpoint,
                        PlanLimitBreachHandler.REASON_EXCEEDED, true);
            }
        }

        metricsService.incrementQuotaAllowed(limitType.name());
        log.debug("Quota consumed: account={}, limitType={}, plan={}", account.getId(), limitType, plan);
    }
}
