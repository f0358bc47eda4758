package uk.gegc.gosuraksha.features.subscription.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.gosuraksha.BaseIntegrationTest;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SubscriptionControllerIntegrationTest extends BaseIntegrationTest {

    @Test
    @DisplayName("GET /api/v1/subscription/me: lapsed paid plan is reported and stored as free")
    void lapsedPlanDowngraded() throws Exception {
        Account account = saveAccount(PlanTier.GO_PRO, Instant.now().minus(Duration.ofDays(1)));

        mockMvc.perform(get("/api/v1/subscription/me").with(user(account.getId().toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("GO_FREE"))
                .andExpect(jsonPath("$.subscription_status").value("EXPIRED"));

        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(stored.getPlan()).isEqualTo(PlanTier.GO_FREE);
        assertThat(stored.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
        assertThat(auditLogRepository.findByAccountIdAndEventTypeOrderByCreatedAtAsc(
                account.getId(), AuditEventType.SUBSCRIPTION_AUTO_DOWNGRADE)).hasSize(1);
    }

    @Test
    @DisplayName("GET /api/v1/subscription/me: active paid plan is returned with its features")
    void activePlan() throws Exception {
        Account account = saveAccount(PlanTier.GO_ULTRA, Instant.now().plus(Duration.ofDays(10)));

        mockMvc.perform(get("/api/v1/subscription/me").with(user(account.getId().toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("GO_ULTRA"))
                .andExpect(jsonPath("$.subscription_status").value("ACTIVE"))
                .andExpect(jsonPath("$.features", hasItem("ULTRA_PRIORITY_PIPELINE")));

        assertThat(accountRepository.findById(account.getId()).orElseThrow().getPlan()).isEqualTo(PlanTier.GO_ULTRA);
    }

    @Test
    @DisplayName("GET /api/v1/subscription/me/features/{feature}: free plan gets upgrade advice")
    void featureGate() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);

        mockMvc.perform(get("/api/v1/subscription/me/features/AI_EXPLAIN").with(user(account.getId().toString())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("UPGRADE_REQUIRED"))
                .andExpect(jsonPath("$.error.feature").value("AI_EXPLAIN"))
                .andExpect(jsonPath("$.error.current_plan").value("GO_FREE"));
    }

    @Test
    @DisplayName("GET /api/v1/subscription/me: without credentials returns 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/v1/subscription/me"))
                .andExpect(status().isUnauthorized());
    }
}
