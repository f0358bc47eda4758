package uk.gegc.gosuraksha.features.quota.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.quota.api.dto.UpgradeAdvice;
import uk.gegc.gosuraksha.features.quota.domain.exception.PlanLimitExceededException;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitPrimitives;
import uk.gegc.gosuraksha.features.ratelimit.application.RateLimitProperties;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;
import uk.gegc.gosuraksha.shared.audit.AuditLogService;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared denial path for windowed and lifetime quotas: arms the post-breach cooldown, records the
 * breach and builds the exception the caller throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanLimitBreachHandler {

    public static final String COOLDOWN_NAMESPACE = "plan-limit:cooldown";
    public static final String REASON_EXCEEDED = "plan_limit_exceeded";
    public static final String REASON_COOLDOWN = "limit_cooldown_active";

    private final RateLimitPrimitives primitives;
    private final RateLimitProperties properties;
    private final UpgradeAdvisor upgradeAdvisor;
    private final AuditLogService auditLogService;
    private final UsageMetricsService metricsService;

    public boolean isCoolingDown(Account account, LimitType limitType) {
        return primitives.isCooldownActive(COOLDOWN_NAMESPACE, account.getId().toString(), limitType.cooldownSubject());
    }

    /**
     * @param armCooldown acquire the cooldown lock; false when the denial came from an already active one
     */
    public PlanLimitExceededException breach(Account account, PlanTier plan, LimitType limitType, int limit,
                                             String endpoint, String reason, boolean armCooldown) {
        if (armCooldown) {
            // Losing the race to a concurrent denial is fine; the lock is armed either way
            primitives.acquireCooldown(COOLDOWN_NAMESPACE, properties.getBreachCooldownSeconds(),
                    account.getId().toString(), limitType.cooldownSubject());
        }

        UpgradeAdvice upgrade = upgradeAdvisor.advise(account, plan, limitType.getFeature(), reason, endpoint);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("plan", plan.name());
        metadata.put("feature", limitType.cooldownSubject());
        metadata.put("endpoint", endpoint != null ? endpoint : "unknown");
        metadata.put("limit_type", limitType.name());
        metadata.put("reason", reason);
        auditLogService.record(account.getId(), AuditEventType.PLAN_LIMIT_EXCEEDED, metadata);
        metricsService.incrementQuotaDenied(limitType.name(), plan.name());

        log.info("Plan limit exceeded: account={}, plan={}, limitType={}, limit={}, reason={}",
                account.getId(), plan, limitType, limit, reason);
        return new PlanLimitExceededException(plan, limitType, limit, reason, upgrade,
                properties.getBreachCooldownSeconds());
    }
}
