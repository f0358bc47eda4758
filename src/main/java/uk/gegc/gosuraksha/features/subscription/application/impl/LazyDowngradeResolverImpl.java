package uk.gegc.gosuraksha.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gosuraksha.features.account.domain.exception.AccountNotFoundException;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.account.domain.repository.AccountRepository;
import uk.gegc.gosuraksha.features.subscription.application.LazyDowngradeResolver;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;
import uk.gegc.gosuraksha.shared.audit.AuditLogService;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LazyDowngradeResolverImpl implements LazyDowngradeResolver {

    private final AccountRepository accountRepository;
    private final AuditLogService auditLogService;
    private final UsageMetricsService metricsService;
    private final Clock clock;

    @Override
    public PlanTier effectivePlan(Account account, Instant now) {
        PlanTier stored = account.getPlan() != null ? account.getPlan() : PlanTier.GO_FREE;
        if (!stored.isPaid()) {
            return PlanTier.GO_FREE;
        }
        Instant expiresAt = account.getSubscriptionExpiresAt();
        if (expiresAt != null && expiresAt.isBefore(now)) {
            return PlanTier.GO_FREE;
        }
        return stored;
    }

    @Override
    public PlanTier effectivePlan(Account account) {
        return effectivePlan(account, clock.instant());
    }

    @Override
    @Transactional
    public Account refresh(Account account) {
        Instant now = clock.instant();
        PlanTier stored = account.getPlan();
        if (stored == null || !stored.isPaid() || effectivePlan(account, now).isPaid()) {
            return account;
        }

        int updated = accountRepository.downgradeIfExpired(
                account.getId(), PlanTier.GO_FREE, SubscriptionStatus.EXPIRED, now);
        if (updated == 0) {
            // A renewal or another reader got there first; return what is stored now
            return accountRepository.findById(account.getId())
                    .orElseThrow(() -> new AccountNotFoundException(account.getId().toString()));
        }

        Instant expiredAt = account.getSubscriptionExpiresAt();
        account.setPlan(PlanTier.GO_FREE);
        account.setSubscriptionStatus(SubscriptionStatus.EXPIRED);

        log.info("Subscription auto-downgraded: account={}, plan={}->{}, expiredAt={}",
                account.getId(), stored, PlanTier.GO_FREE, expiredAt);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("old_plan", stored.name());
        metadata.put("new_plan", PlanTier.GO_FREE.name());
        metadata.put("expired_at", String.valueOf(expiredAt));
        auditLogService.record(account.getId(), AuditEventType.SUBSCRIPTION_AUTO_DOWNGRADE, metadata);
        metricsService.incrementAutoDowngrade(stored.name());
        return account;
    }
}
