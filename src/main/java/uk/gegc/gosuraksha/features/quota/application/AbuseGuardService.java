package uk.gegc.gosuraksha.features.quota.application;

import java.util.UUID;

/**
 * Throttles that apply regardless of plan. Denials raise
 * {@link uk.gegc.gosuraksha.shared.exception.RateLimitExceededException}.
 */
public interface AbuseGuardService {

    /**
     * Applies the cooldown and rate windows and rejects an address scanned within the block
     * period. Does not mark the address; see {@link #recordEmailScan}.
     */
    void guardEmailScan(UUID accountId, String email, String clientIp);

    /**
     * Starts the duplicate-scan block for an admitted scan. Called after the plan limit passes.
     */
    void recordEmailScan(UUID accountId, String email);

    void guardAiInsight(String clientIp);
}
