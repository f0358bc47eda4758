package uk.gegc.gosuraksha.shared.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Best-effort audit trail. Implementations never throw: a failed audit write is logged and the
 * calling operation proceeds with its original outcome.
 */
public interface AuditLogService {

    void record(UUID accountId, AuditEventType eventType, Map<String, ?> metadata);

    void record(UUID accountId, AuditEventType eventType, String ipAddress, Map<String, ?> metadata);
}
