package uk.gegc.gosuraksha.features.quota.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.quota.domain.model.PlanLimit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StaticPlanPolicy")
class StaticPlanPolicyTest {

    private final StaticPlanPolicy policy = new StaticPlanPolicy();

    @Test
    @DisplayName("free tier metered ceilings")
    void freeLimits() {
        assertThat(policy.limitFor(PlanTier.GO_FREE, PlanLimit.THREAT_DAILY)).hasValue(3);
        assertThat(policy.limitFor(PlanTier.GO_FREE, PlanLimit.EMAIL_MONTHLY)).hasValue(3);
        assertThat(policy.limitFor(PlanTier.GO_FREE, PlanLimit.AI_IMAGE_LIFETIME)).hasValue(1);
    }

    @Test
    @DisplayName("pro tier has no metered ceiling and is exempt")
    void proUnlimited() {
        assertThat(policy.limitFor(PlanTier.GO_PRO, PlanLimit.THREAT_DAILY)).isEmpty();
        assertThat(policy.isExemptFromMeteredLimits(PlanTier.GO_PRO)).isTrue();
        assertThat(policy.isExemptFromMeteredLimits(PlanTier.GO_ULTRA)).isTrue();
        assertThat(policy.isExemptFromMeteredLimits(PlanTier.FAMILY_PRO)).isFalse();
        assertThat(policy.isExemptFromMeteredLimits(PlanTier.GO_FREE)).isFalse();
    }

    @Test
    @DisplayName("ultra adds the priority pipeline to pro features")
    void ultraFeatures() {
        assertThat(policy.featuresOf(PlanTier.GO_ULTRA)).containsAll(policy.featuresOf(PlanTier.GO_PRO));
        assertThat(policy.hasFeature(PlanTier.GO_ULTRA, Feature.ULTRA_PRIORITY_PIPELINE)).isTrue();
        assertThat(policy.hasFeature(PlanTier.GO_PRO, Feature.ULTRA_PRIORITY_PIPELINE)).isFalse();
    }

    @Test
    @DisplayName("free tier lacks premium features")
    void freeFeatures() {
        assertThat(policy.hasFeature(PlanTier.GO_FREE, Feature.AI_EXPLAIN)).isFalse();
        assertThat(policy.hasFeature(PlanTier.GO_FREE, Feature.EMAIL_BREACH_COUNT)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(PlanTier.class)
    @DisplayName("every plan defines every limit")
    void completeTables(PlanTier plan) {
        assertThat(policy.limitsOf(plan)).containsOnlyKeys(PlanLimit.values());
    }
}
