package uk.gegc.gosuraksha.features.account.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    /**
     * Loads the account with a row-level write lock held until the surrounding transaction ends.
     * Concurrent subscription callbacks for the same account serialise here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.id = :id")
    Optional<Account> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Consumes one unit of the lifetime AI-image allowance.
     *
     * @return 1 when a unit was consumed, 0 when the ceiling had already been reached
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Account a
        SET a.aiImageLifetimeUsed = a.aiImageLifetimeUsed + 1
        WHERE a.id = :id AND a.aiImageLifetimeUsed < :ceiling
        """)
    int incrementAiImageLifetimeUsedIfBelow(@Param("id") UUID id, @Param("ceiling") int ceiling);

    /**
     * Rewrites a lapsed paid plan to the free tier. The predicate re-checks paid plan and expiry so
     * a renewal committed in between is never overwritten.
     *
     * @return 1 when the account was downgraded, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Account a
        SET a.plan = :freePlan,
            a.subscriptionStatus = :expiredStatus,
            a.updatedAt = :now
        WHERE a.id = :id
          AND a.plan <> :freePlan
          AND a.subscriptionExpiresAt IS NOT NULL
          AND a.subscriptionExpiresAt < :now
        """)
    int downgradeIfExpired(@Param("id") UUID id,
                           @Param("freePlan") PlanTier freePlan,
                           @Param("expiredStatus") SubscriptionStatus expiredStatus,
                           @Param("now") Instant now);
}
