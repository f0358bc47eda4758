package uk.gegc.gosuraksha.features.subscription.application;

import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;

import java.time.Instant;

/**
 * Single place that decides which plan an account is entitled to right now. Billing providers
 * may deliver the expiry callback late or never, so a lapsed paid plan is treated as free as soon
 * as its expiry passes.
 */
public interface LazyDowngradeResolver {

    /**
     * Pure: free stays free; a paid plan whose expiry lies before {@code now} is free; otherwise
     * the stored plan. Paid plans without an expiry keep their stored plan.
     */
    PlanTier effectivePlan(Account account, Instant now);

    /** {@link #effectivePlan(Account, Instant)} at the current time. */
    PlanTier effectivePlan(Account account);

    /**
     * Persists the downgrade when the stored plan has lapsed and returns the account as it is
     * now stored. Accounts that need no change are returned as given.
     */
    Account refresh(Account account);
}
