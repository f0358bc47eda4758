package uk.gegc.gosuraksha.shared.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByAccountIdAndEventTypeOrderByCreatedAtAsc(UUID accountId, AuditEventType eventType);

    long countByEventType(AuditEventType eventType);
}
