package uk.gegc.gosuraksha.features.quota.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.api.dto.DiscountEligibility;
import uk.gegc.gosuraksha.features.quota.api.dto.UpgradeAdvice;
import uk.gegc.gosuraksha.features.quota.domain.model.Feature;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;
import uk.gegc.gosuraksha.shared.audit.AuditLogService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the upgrade recommendation attached to quota and feature denials, including the
 * first-upgrade discount window.
 */
@Component
@RequiredArgsConstructor
public class UpgradeAdvisor {

    public static final int DISCOUNT_WINDOW_DAYS = 30;

    private static final List<String> DEFAULT_BENEFITS = List.of("Higher limits and premium security features");

    private static final Map<Feature, Recommendation> RECOMMENDATIONS = new EnumMap<>(Feature.class);

    static {
        RECOMMENDATIONS.put(Feature.THREAT_SCAN, new Recommendation(PlanTier.GO_PRO,
                "Higher threat scan limits", "Priority protection features"));
        RECOMMENDATIONS.put(Feature.PASSWORD_SCAN, new Recommendation(PlanTier.GO_PRO,
                "Higher password scan limits", "Expanded security diagnostics"));
        RECOMMENDATIONS.put(Feature.AI_IMAGE_SCAN, new Recommendation(PlanTier.GO_PRO,
                "More AI image scans", "Extended deepfake protection"));
        RECOMMENDATIONS.put(Feature.EMAIL_BREACH_COUNT, new Recommendation(PlanTier.GO_PRO,
                "Higher email breach scan limits", "Extended breach visibility"));
        RECOMMENDATIONS.put(Feature.QR_UNLIMITED, new Recommendation(PlanTier.GO_PRO,
                "Unlimited QR scans", "Unlimited QR scam reports"));
        RECOMMENDATIONS.put(Feature.OCR_SCAN, new Recommendation(PlanTier.GO_PRO,
                "OCR scam detection", "Screenshot analysis", "Higher scan limits"));
        RECOMMENDATIONS.put(Feature.AI_EXPLAIN, new Recommendation(PlanTier.GO_PRO,
                "Human-readable security explanations", "Attack intent analysis", "Clear next steps"));
        RECOMMENDATIONS.put(Feature.RISK_INSIGHTS, new Recommendation(PlanTier.GO_PRO,
                "Behavioral scam patterns", "Risk timeline analysis", "Personalized security recommendations"));
        RECOMMENDATIONS.put(Feature.CYBER_CARD_ACCESS, new Recommendation(PlanTier.GO_PRO,
                "Monthly Cyber Card score", "Historical cyber score tracking"));
        RECOMMENDATIONS.put(Feature.FAMILY_ALERTS, new Recommendation(PlanTier.FAMILY_PRO,
                "Family security alerts", "Family-level risk visibility"));
        RECOMMENDATIONS.put(Feature.ULTRA_PRIORITY_PIPELINE, new Recommendation(PlanTier.GO_ULTRA,
                "Priority protection pipeline", "Fastest incident handling"));
    }

    private final AuditLogService auditLogService;
    private final Clock clock;

    /**
     * Builds advice for {@code account} on {@code plan} and writes a best-effort
     * {@code UPGRADE_REQUIRED} audit entry.
     */
    public UpgradeAdvice advise(Account account, PlanTier plan, Feature feature, String reason, String endpoint) {
        Recommendation recommendation = feature != null ? RECOMMENDATIONS.get(feature) : null;
        PlanTier recommendedPlan = recommendation != null
                ? recommendation.plan()
                : (plan == PlanTier.GO_FREE ? PlanTier.GO_PRO : PlanTier.GO_ULTRA);
        List<String> benefits = recommendation != null ? recommendation.benefits() : DEFAULT_BENEFITS;
        String resolvedEndpoint = endpoint != null ? endpoint : "unknown";
        String featureName = feature != null ? feature.name() : null;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("plan", plan.name());
        metadata.put("feature", featureName != null ? featureName : "UNKNOWN");
        metadata.put("endpoint", resolvedEndpoint);
        metadata.put("reason", reason);
        auditLogService.record(account.getId(), AuditEventType.UPGRADE_REQUIRED, metadata);

        return new UpgradeAdvice(
                "UPGRADE_REQUIRED",
                "Upgrade required",
                reason,
                featureName,
                plan,
                resolvedEndpoint,
                recommendedPlan,
                benefits,
                discountFor(account)
        );
    }

    public DiscountEligibility discountFor(Account account) {
        if (account.isFirstUpgradeUsed()) {
            return DiscountEligibility.ineligible(DISCOUNT_WINDOW_DAYS, "first_upgrade_already_used");
        }
        Instant createdAt = account.getCreatedAt();
        if (createdAt == null) {
            return DiscountEligibility.ineligible(DISCOUNT_WINDOW_DAYS, "created_at_unavailable");
        }
        Instant now = clock.instant();
        Instant discountUntil = createdAt.plus(Duration.ofDays(DISCOUNT_WINDOW_DAYS));
        boolean eligible = now.isBefore(discountUntil);
        long daysRemaining = eligible ? Duration.between(now, discountUntil).toDays() : 0;
        return new DiscountEligibility(eligible, DISCOUNT_WINDOW_DAYS, discountUntil, daysRemaining, null);
    }

    private record Recommendation(PlanTier plan, List<String> benefits) {
        Recommendation(PlanTier plan, String... benefits) {
            this(plan, List.of(benefits));
        }
    }
}
