package uk.gegc.gosuraksha.features.account.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Account aggregate. Owns the current subscription state and the lifetime usage counter; the
 * subscription event ledger only records history.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor
public class Account {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "email", unique = true, length = 254)
    private String email;

    @Convert(converter = PlanTierConverter.class)
    @Column(name = "plan", nullable = false, length = 32)
    private PlanTier plan = PlanTier.GO_FREE;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_status", nullable = false, length = 16)
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.ACTIVE;

    @Column(name = "subscription_expires_at")
    private Instant subscriptionExpiresAt;

    @Column(name = "last_subscription_event_at")
    private Instant lastSubscriptionEventAt;

    @Column(name = "first_upgrade_used", nullable = false)
    private boolean firstUpgradeUsed;

    // Only ever changed through AccountRepository.incrementAiImageLifetimeUsedIfBelow
    @Column(name = "ai_image_lifetime_used", nullable = false)
    private int aiImageLifetimeUsed;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public Account(UUID id, String email) {
        this.id = id;
        this.email = email;
    }
}
