package uk.gegc.gosuraksha.features.quota.application;

import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.quota.domain.model.PlanLimit;

import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Pure lookup of what a plan is entitled to.
 */
public interface PlanPolicy {

    /**
     * @return the ceiling, or empty when the plan is unlimited for {@code limit}
     */
    OptionalInt limitFor(PlanTier plan, PlanLimit limit);

    /**
     * Plans that skip metered quota checks entirely, without touching the counter store.
     */
    boolean isExemptFromMeteredLimits(PlanTier plan);

    boolean hasFeature(PlanTier plan, Feature feature);

    Set<Feature> featuresOf(PlanTier plan);

    /**
     * All limits of {@code plan}; unlimited entries map to null.
     */
    Map<PlanLimit, Integer> limitsOf(PlanTier plan);
}
