package uk.gegc.gosuraksha.features.subscription.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.gosuraksha.features.subscription.domain.model.SubscriptionEvent;

import java.util.Optional;
import java.util.UUID;

public interface SubscriptionEventRepository extends JpaRepository<SubscriptionEvent, UUID> {

    boolean existsByEventId(String eventId);

    Optional<SubscriptionEvent> findByEventId(String eventId);

    long countByEventId(String eventId);
}
