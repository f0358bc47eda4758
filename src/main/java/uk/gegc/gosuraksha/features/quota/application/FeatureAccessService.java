package uk.gegc.gosuraksha.features.quota.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.domain.exception.UpgradeRequiredException;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.subscription.application.LazyDowngradeResolver;

/**
 * Feature gate on the effective plan.
 */
@Service
@RequiredArgsConstructor
public class FeatureAccessService {

    public static final String REASON_FEATURE_NOT_IN_PLAN = "feature_not_in_plan";

    private final PlanPolicy planPolicy;
    private final UpgradeAdvisor upgradeAdvisor;
    private final LazyDowngradeResolver lazyDowngradeResolver;

    public void requireFeature(Account account, Feature feature, String endpoint) {
        PlanTier plan = lazyDowngradeResolver.effectivePlan(account);
        if (!planPolicy.hasFeature(plan, feature)) {
            throw new UpgradeRequiredException(
                    upgradeAdvisor.advise(account, plan, feature, REASON_FEATURE_NOT_IN_PLAN, endpoint));
        }
    }
}
