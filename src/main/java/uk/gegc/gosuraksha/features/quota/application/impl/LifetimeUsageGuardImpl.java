package uk.gegc.gosuraksha.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.repository.AccountRepository;
import uk.gegc.gosuraksha.features.quota.application.LifetimeUsageGuard;
import uk.gegc.gosuraksha.features.quota.application.PlanLimitBreachHandler;
import uk.gegc.gosuraksha.features.quota.domain.model.LimitType;
import uk.gegc.gosuraksha.features.subscription.application.LazyDowngradeResolver;

@Slf4j
@Service
@RequiredArgsConstructor
public class LifetimeUsageGuardImpl implements LifetimeUsageGuard {

    private final AccountRepository accountRepository;
    private final PlanLimitBreachHandler breachHandler;
    private final LazyDowngradeResolver lazyDowngradeResolver;

    @Override
    @Transactional
    public void consumeLifetime(Account account, int ceiling, String endpoint) {
        // The database decides: 0 rows means this or a concurrent call already reached the ceiling
        int updated = accountRepository.incrementAiImageLifetimeUsedIfBelow(account.getId(), ceiling);
        if (updated < 1) {
            throw breachHandler.breach(account, lazyDowngradeResolver.effectivePlan(account),
                    LimitType.AI_IMAGE_LIFETIME, ceiling, endpoint, PlanLimitBreachHandler.REASON_EXCEEDED, true);
        }
        account.setAiImageLifetimeUsed(account.getAiImageLifetimeUsed() + 1);
        log.debug("Lifetime AI image scan consumed: account={}, used={}", account.getId(), account.getAiImageLifetimeUsed());
    }
}
