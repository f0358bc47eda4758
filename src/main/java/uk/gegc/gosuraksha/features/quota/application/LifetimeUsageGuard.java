package uk.gegc.gosuraksha.features.quota.application;

import uk.gegc.gosuraksha.features.account.domain.model.Account;

/**
 * Never-resetting allowances backed by a guarded counter column on the account row.
 */
public interface LifetimeUsageGuard {

    /**
     * Consumes one lifetime AI-image scan. On success the in-memory {@code account} reflects the
     * new count.
     */
    void consumeLifetime(Account account, int ceiling, String endpoint);
}
