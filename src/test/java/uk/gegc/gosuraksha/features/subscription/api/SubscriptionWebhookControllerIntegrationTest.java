package uk.gegc.gosuraksha.features.subscription.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import uk.gegc.gosuraksha.BaseIntegrationTest;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.subscription.domain.model.EventProcessingStatus;
import uk.gegc.gosuraksha.features.subscription.domain.model.SubscriptionEvent;
import uk.gegc.gosuraksha.shared.api.problem.ErrorTypes;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SubscriptionWebhookControllerIntegrationTest extends BaseIntegrationTest {

    private static final String BEARER = "Bearer test-revenuecat-secret";

    private static String revenueCatEvent(String eventId, String type, UUID accountId, String productId,
                                          Instant expiresAt, Instant eventAt) {
        return """
                {"api_version": "1.0",
                 "event": {"id": "%s", "type": "%s", "app_user_id": "%s", "product_id": "%s",
                           "expiration_at_ms": %d, "event_timestamp_ms": %d}}
                """.formatted(eventId, type, accountId, productId, expiresAt.toEpochMilli(), eventAt.toEpochMilli());
    }

    private static MockHttpServletRequestBuilder revenueCat(String payload) {
        return post("/webhooks/revenuecat")
                .header("Authorization", BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: renewal is applied to the account")
    void renewalApplied() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);
        Instant eventAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Instant expiresAt = eventAt.plus(Duration.ofDays(30));

        mockMvc.perform(revenueCat(revenueCatEvent("evt_apply", "INITIAL_PURCHASE", account.getId(),
                        "go_pro_monthly", expiresAt, eventAt)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.idempotent").value(false))
                .andExpect(jsonPath("$.result").value("APPLIED"))
                .andExpect(jsonPath("$.plan").value("GO_PRO"))
                .andExpect(jsonPath("$.subscription_status").value("ACTIVE"));

        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(stored.getPlan()).isEqualTo(PlanTier.GO_PRO);
        assertThat(stored.getSubscriptionExpiresAt()).isEqualTo(expiresAt);
        assertThat(stored.getLastSubscriptionEventAt()).isEqualTo(eventAt);
        assertThat(stored.isFirstUpgradeUsed()).isTrue();
        assertThat(auditLogRepository.findByAccountIdAndEventTypeOrderByCreatedAtAsc(
                account.getId(), AuditEventType.SUBSCRIPTION_UPDATED)).hasSize(1);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: redelivery of the same event is acknowledged without reapplying")
    void redeliveryIsIdempotent() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);
        Instant eventAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        String payload = revenueCatEvent("evt_again", "RENEWAL", account.getId(), "go_pro_monthly",
                eventAt.plus(Duration.ofDays(30)), eventAt);

        mockMvc.perform(revenueCat(payload)).andExpect(status().isOk());
        Account afterFirst = accountRepository.findById(account.getId()).orElseThrow();

        mockMvc.perform(revenueCat(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.idempotent").value(true))
                .andExpect(jsonPath("$.event_id").value("evt_again"));

        Account afterSecond = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(subscriptionEventRepository.countByEventId("evt_again")).isEqualTo(1);
        assertThat(afterSecond.getPlan()).isEqualTo(afterFirst.getPlan());
        assertThat(afterSecond.getSubscriptionExpiresAt()).isEqualTo(afterFirst.getSubscriptionExpiresAt());
        assertThat(afterSecond.getLastSubscriptionEventAt()).isEqualTo(afterFirst.getLastSubscriptionEventAt());
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: an older event arriving late is recorded but not applied")
    void olderEventIgnored() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);
        Instant t2 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Instant t1 = t2.minus(Duration.ofHours(1));
        Instant expiresAt = t2.plus(Duration.ofDays(30));

        mockMvc.perform(revenueCat(revenueCatEvent("evt_new", "RENEWAL", account.getId(), "go_ultra_monthly",
                        expiresAt, t2)))
                .andExpect(status().isOk());
        mockMvc.perform(revenueCat(revenueCatEvent("evt_old", "CANCELLATION", account.getId(), "go_pro_monthly",
                        t1.plus(Duration.ofDays(30)), t1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("IGNORED_OUT_OF_ORDER"));

        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(stored.getPlan()).isEqualTo(PlanTier.GO_ULTRA);
        assertThat(stored.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(stored.getSubscriptionExpiresAt()).isEqualTo(expiresAt);
        assertThat(stored.getLastSubscriptionEventAt()).isEqualTo(t2);
        assertThat(subscriptionEventRepository.findByEventId("evt_old"))
                .map(SubscriptionEvent::getProcessingStatus)
                .contains(EventProcessingStatus.IGNORED_OUT_OF_ORDER);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: concurrent deliveries of one event apply it once")
    void concurrentDeliveries() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);
        Instant eventAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        String payload = revenueCatEvent("evt_123", "RENEWAL", account.getId(), "go_pro_monthly",
                eventAt.plus(Duration.ofDays(30)), eventAt);

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<MvcResult>> results = new ArrayList<>();
            Callable<MvcResult> delivery = () -> {
                start.await();
                return mockMvc.perform(revenueCat(payload)).andReturn();
            };
            results.add(executor.submit(delivery));
            results.add(executor.submit(delivery));
            start.countDown();

            List<Integer> statuses = new ArrayList<>();
            List<String> bodies = new ArrayList<>();
            for (Future<MvcResult> result : results) {
                MvcResult mvcResult = result.get(30, TimeUnit.SECONDS);
                statuses.add(mvcResult.getResponse().getStatus());
                bodies.add(mvcResult.getResponse().getContentAsString());
            }

            // The loser sees either the committed ledger row (200) or the unique constraint (409)
            assertThat(statuses).allMatch(s -> s == 200 || s == 409);
            assertThat(bodies).filteredOn(b -> b.contains("\"result\":\"APPLIED\"")).hasSize(1);
            assertThat(bodies).filteredOn(b -> b.contains("\"idempotent\":true")).hasSize(1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(subscriptionEventRepository.countByEventId("evt_123")).isEqualTo(1);
        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(stored.getPlan()).isEqualTo(PlanTier.GO_PRO);
        assertThat(stored.getLastSubscriptionEventAt()).isEqualTo(eventAt);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: wrong credential returns 401 and records nothing")
    void wrongSecret() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);
        Instant now = Instant.now();

        mockMvc.perform(post("/webhooks/revenuecat")
                        .header("Authorization", "Bearer not-the-secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(revenueCatEvent("evt_forged", "RENEWAL", account.getId(), "go_pro_monthly",
                                now.plus(Duration.ofDays(30)), now)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.type").value(ErrorTypes.WEBHOOK_INVALID_SIGNATURE.toString()));

        assertThat(subscriptionEventRepository.count()).isZero();
        assertThat(auditLogRepository.count()).isZero();
        assertThat(accountRepository.findById(account.getId()).orElseThrow().getPlan()).isEqualTo(PlanTier.GO_FREE);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: missing app_user_id returns 400 and is audited")
    void missingAccountReference() throws Exception {
        String payload = """
                {"event": {"id": "evt_anon", "type": "RENEWAL", "product_id": "go_pro_monthly",
                           "expiration_at_ms": 4102444800000}}
                """;

        mockMvc.perform(revenueCat(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(ErrorTypes.MALFORMED_SUBSCRIPTION_EVENT.toString()));

        assertThat(subscriptionEventRepository.count()).isZero();
        assertThat(auditLogRepository.countByEventType(AuditEventType.SUBSCRIPTION_WEBHOOK_EVENT)).isEqualTo(1);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: event type too long for the ledger is rejected, not acknowledged")
    void overlongEventTypeRejected() throws Exception {
        Account account = saveAccount(PlanTier.GO_FREE, null);
        Instant eventAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        mockMvc.perform(revenueCat(revenueCatEvent("evt_long_type", "X".repeat(80), account.getId(),
                        "go_pro_monthly", eventAt.plus(Duration.ofDays(30)), eventAt)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value(ErrorTypes.MALFORMED_SUBSCRIPTION_EVENT.toString()));

        assertThat(subscriptionEventRepository.countByEventId("evt_long_type")).isZero();
        assertThat(accountRepository.findById(account.getId()).orElseThrow().getPlan()).isEqualTo(PlanTier.GO_FREE);
    }

    @Test
    @DisplayName("POST /webhooks/revenuecat: unknown account returns 404")
    void unknownAccount() throws Exception {
        Instant now = Instant.now();

        mockMvc.perform(revenueCat(revenueCatEvent("evt_ghost", "RENEWAL", UUID.randomUUID(), "go_pro_monthly",
                        now.plus(Duration.ofDays(30)), now)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value(ErrorTypes.ACCOUNT_NOT_FOUND.toString()));

        assertThat(subscriptionEventRepository.count()).isZero();
    }

    @Test
    @DisplayName("POST /webhooks/{provider}: unknown provider returns 404")
    void unknownProvider() throws Exception {
        mockMvc.perform(post("/webhooks/paypal")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
    }
}
