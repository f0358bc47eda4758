package uk.gegc.gosuraksha.features.subscription.application;

import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import uk.gegc.gosuraksha.features.account.domain.exception.AccountNotFoundException;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.repository.AccountRepository;

import java.util.UUID;

/**
 * Loads the authenticated account and brings its subscription state up to date. Every
 * authenticated read goes through here before any quota check.
 */
@Component
@RequiredArgsConstructor
public class CurrentAccountResolver {

    private final AccountRepository accountRepository;
    private final LazyDowngradeResolver lazyDowngradeResolver;

    public Account resolve(Authentication authentication) {
        String name = authentication.getName();
        UUID accountId;
        try {
            accountId = UUID.fromString(name);
        } catch (IllegalArgumentException e) {
            throw new AccountNotFoundException(name);
        }
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(name));
        return lazyDowngradeResolver.refresh(account);
    }
}
