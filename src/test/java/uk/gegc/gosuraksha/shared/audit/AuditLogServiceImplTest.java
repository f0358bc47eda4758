package uk.gegc.gosuraksha.shared.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceImplTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuditLogServiceImpl auditLogService;

    @BeforeEach
    void setUp() {
        auditLogService = new AuditLogServiceImpl(auditLogRepository, new ObjectMapper(), transactionManager);
    }

    @Test
    void record_writesEntryWithJsonMetadataInNewTransaction() throws Exception {
        UUID accountId = UUID.randomUUID();

        auditLogService.record(accountId, AuditEventType.RATE_LIMIT_BLOCKED, "203.0.113.9",
                Map.of("guard", "email_scan_duplicate"));

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog entry = captor.getValue();
        assertThat(entry.getAccountId()).isEqualTo(accountId);
        assertThat(entry.getEventType()).isEqualTo(AuditEventType.RATE_LIMIT_BLOCKED);
        assertThat(entry.getIpAddress()).isEqualTo("203.0.113.9");
        assertThat(new ObjectMapper().readTree(entry.getMetadata()).get("guard").asText())
                .isEqualTo("email_scan_duplicate");
        verify(transactionManager).getTransaction(argThat(definition ->
                definition.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRES_NEW));
    }

    @Test
    void record_emptyMetadataIsStoredAsNull() {
        auditLogService.record(null, AuditEventType.SUBSCRIPTION_WEBHOOK_EVENT, Map.of());

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertThat(captor.getValue().getMetadata()).isNull();
        assertThat(captor.getValue().getAccountId()).isNull();
    }

    @Test
    void record_storeFailureDoesNotPropagate() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        assertThatCode(() -> auditLogService.record(UUID.randomUUID(), AuditEventType.PLAN_LIMIT_EXCEEDED,
                Map.of("limit_type", "THREAT_DAILY")))
                .doesNotThrowAnyException();
    }
}
