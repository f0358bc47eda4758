package uk.gegc.gosuraksha.features.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger row for one provider event. The unique {@code event_id} is the idempotency key; only
 * {@code processingStatus} changes, and only inside the transaction that inserts the row.
 */
@Entity
@Table(name = "subscription_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_subscription_events_event_id", columnNames = "event_id"),
        indexes = @Index(name = "idx_subscription_events_account", columnList = "account_id, event_at"))
@Getter
@Setter
@NoArgsConstructor
public class SubscriptionEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false, length = 128)
    private String eventId;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Column(name = "provider", nullable = false, updatable = false, length = 32)
    private String provider;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    @Column(name = "event_at", updatable = false)
    private Instant eventAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false, length = 32)
    private EventProcessingStatus processingStatus = EventProcessingStatus.RECEIVED;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "LONGTEXT")
    private String payload;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
