package uk.gegc.gosuraksha;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.repository.AccountRepository;
import uk.gegc.gosuraksha.features.subscription.domain.repository.SubscriptionEventRepository;
import uk.gegc.gosuraksha.shared.audit.AuditLogRepository;
import uk.gegc.gosuraksha.testsupport.InMemoryCounterStore;
import uk.gegc.gosuraksha.testsupport.TestCounterStoreConfig;

import java.time.Instant;
import java.util.UUID;

/**
 * Base class for application-context tests.
 *
 * <p>Not transactional: webhook processing commits in its own transactions and the concurrency
 * tests need committed rows, so each test starts from emptied tables and counters instead.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestCounterStoreConfig.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class BaseIntegrationTest {

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected AccountRepository accountRepository;

    @Autowired
    protected SubscriptionEventRepository subscriptionEventRepository;

    @Autowired
    protected AuditLogRepository auditLogRepository;

    @Autowired
    protected InMemoryCounterStore counterStore;

    @BeforeEach
    void resetState() {
        subscriptionEventRepository.deleteAll();
        auditLogRepository.deleteAll();
        accountRepository.deleteAll();
        counterStore.clear();
        counterStore.setUnavailable(false);
    }

    protected Account saveAccount(PlanTier plan, Instant expiresAt) {
        UUID id = UUID.randomUUID();
        Account account = new Account(id, id + "@example.com");
        account.setPlan(plan);
        account.setSubscriptionExpiresAt(expiresAt);
        return accountRepository.save(account);
    }
}
