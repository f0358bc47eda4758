package uk.gegc.gosuraksha.shared.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
public class AuditLogServiceImpl implements AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;

    public AuditLogServiceImpl(AuditLogRepository auditLogRepository,
                               ObjectMapper objectMapper,
                               PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void record(UUID accountId, AuditEventType eventType, Map<String, ?> metadata) {
        record(accountId, eventType, null, metadata);
    }

    @Override
    public void record(UUID accountId, AuditEventType eventType, String ipAddress, Map<String, ?> metadata) {
        try {
            AuditLog entry = new AuditLog();
            entry.setAccountId(accountId);
            entry.setEventType(eventType);
            entry.setIpAddress(ipAddress);
            entry.setMetadata(toJson(metadata));
            // Own transaction so a rollback of the caller never loses the audit row and vice versa
            requiresNew.executeWithoutResult(status -> auditLogRepository.save(entry));
            log.debug("Audit logged: {} for account {}", eventType, accountId);
        } catch (Exception e) {
            log.error("Failed to write {} audit for account {}: {}", eventType, accountId, e.getMessage(), e);
        }
    }

    private String toJson(Map<String, ?> metadata) throws JsonProcessingException {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        return objectMapper.writeValueAsString(metadata);
    }
}
