package uk.gegc.gosuraksha.features.quota.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.application.PlanPolicy;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.features.quota.domain.model.PlanLimit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

import static uk.gegc.gosuraksha.features.quota.domain.model.PlanLimit.*;

@Component
public class StaticPlanPolicy implements PlanPolicy {

    private static final Set<PlanTier> METERED_EXEMPT = EnumSet.of(PlanTier.GO_PRO, PlanTier.GO_ULTRA);

    private static final Set<Feature> PRO_FEATURES = EnumSet.of(
            Feature.EMAIL_BREACH_COUNT,
            Feature.EMAIL_BREACH_DETAILS,
            Feature.OCR_SCAN,
            Feature.AI_EXPLAIN,
            Feature.RISK_INSIGHTS,
            Feature.CYBER_CARD_ACCESS,
            Feature.QR_UNLIMITED,
            Feature.TRUSTED_CONTACT_LIMIT,
            Feature.PRIORITY_SOS
    );

    private final Map<PlanTier, Set<Feature>> features = new EnumMap<>(PlanTier.class);
    private final Map<PlanTier, Map<PlanLimit, Integer>> limits = new EnumMap<>(PlanTier.class);

    public StaticPlanPolicy() {
        Set<Feature> ultra = EnumSet.copyOf(PRO_FEATURES);
        ultra.add(Feature.ULTRA_PRIORITY_PIPELINE);
        Set<Feature> family = EnumSet.of(Feature.EMAIL_BREACH_COUNT, Feature.TRUSTED_CONTACT_LIMIT, Feature.FAMILY_ALERTS);

        features.put(PlanTier.GO_FREE, EnumSet.of(Feature.EMAIL_BREACH_COUNT, Feature.TRUSTED_CONTACT_LIMIT));
        features.put(PlanTier.GO_PRO, PRO_FEATURES);
        features.put(PlanTier.GO_ULTRA, ultra);
        features.put(PlanTier.FAMILY_BASIC, family);
        features.put(PlanTier.FAMILY_PRO, EnumSet.copyOf(family));

        limits.put(PlanTier.GO_FREE, table(1, 3, 3, 3, 3, 1, 3, 3, 3, 3, 3));
        limits.put(PlanTier.GO_PRO, table(1, null, null, null, null, null, 100, 20, 20, null, null));
        limits.put(PlanTier.GO_ULTRA, table(1, null, null, null, null, null, 100, 20, 20, null, null));
        limits.put(PlanTier.FAMILY_BASIC, table(3, 3, 3, 3, 3, 1, 10, 3, 3, 3, 3));
        limits.put(PlanTier.FAMILY_PRO, table(6, 3, 3, 3, 3, 1, 10, 3, 3, 3, 3));
    }

    @Override
    public OptionalInt limitFor(PlanTier plan, PlanLimit limit) {
        Integer value = limitsOf(plan).get(limit);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public boolean isExemptFromMeteredLimits(PlanTier plan) {
        return METERED_EXEMPT.contains(plan);
    }

    @Override
    public boolean hasFeature(PlanTier plan, Feature feature) {
        return featuresOf(plan).contains(feature);
    }

    @Override
    public Set<Feature> featuresOf(PlanTier plan) {
        return Collections.unmodifiableSet(features.getOrDefault(plan, features.get(PlanTier.GO_FREE)));
    }

    @Override
    public Map<PlanLimit, Integer> limitsOf(PlanTier plan) {
        return Collections.unmodifiableMap(limits.getOrDefault(plan, limits.get(PlanTier.GO_FREE)));
    }

    // Argument order follows PlanLimit declaration order
    private static Map<PlanLimit, Integer> table(Integer trustedContactMax, Integer threatDaily, Integer emailMonthly,
                                                 Integer passwordMonthly, Integer qrWeekly, Integer aiImageLifetime,
                                                 Integer analyzeDailyThreat, Integer analyzeDailyEmail,
                                                 Integer analyzeDailyPassword, Integer qrWeeklyScan,
                                                 Integer qrWeeklyReport) {
        Map<PlanLimit, Integer> table = new EnumMap<>(PlanLimit.class);
        table.put(TRUSTED_CONTACT_MAX, trustedContactMax);
        table.put(THREAT_DAILY, threatDaily);
        table.put(EMAIL_MONTHLY, emailMonthly);
        table.put(PASSWORD_MONTHLY, passwordMonthly);
        table.put(QR_WEEKLY, qrWeekly);
        table.put(AI_IMAGE_LIFETIME, aiImageLifetime);
        table.put(ANALYZE_DAILY_THREAT, analyzeDailyThreat);
        table.put(ANALYZE_DAILY_EMAIL, analyzeDailyEmail);
        table.put(ANALYZE_DAILY_PASSWORD, analyzeDailyPassword);
        table.put(QR_WEEKLY_SCAN, qrWeeklyScan);
        table.put(QR_WEEKLY_REPORT, qrWeeklyReport);
        return table;
    }
}
