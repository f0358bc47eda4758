package uk.gegc.gosuraksha.features.subscription.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.gegc.gosuraksha.features.account.domain.model.Account;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.account.domain.repository.AccountRepository;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;
import uk.gegc.gosuraksha.shared.audit.AuditLogService;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;
import uk.gegc.gosuraksha.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LazyDowngradeResolverImpl")
class LazyDowngradeResolverImplTest {

    private static final Instant NOW = Instant.parse("2025-03-14T10:00:00Z");

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private UsageMetricsService metricsService;

    private MutableClock clock;
    private LazyDowngradeResolverImpl resolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        resolver = new LazyDowngradeResolverImpl(accountRepository, auditLogService, metricsService, clock);
    }

    private static Account account(PlanTier plan, Instant expiresAt) {
        Account account = new Account(UUID.randomUUID(), "user@example.com");
        account.setPlan(plan);
        account.setSubscriptionExpiresAt(expiresAt);
        return account;
    }

    @Nested
    @DisplayName("effectivePlan")
    class EffectivePlan {

        @Test
        @DisplayName("free stays free")
        void free() {
            assertThat(resolver.effectivePlan(account(PlanTier.GO_FREE, null), NOW)).isEqualTo(PlanTier.GO_FREE);
        }

        @Test
        @DisplayName("paid plan with future expiry is kept")
        void paidActive() {
            Account account = account(PlanTier.GO_PRO, NOW.plus(Duration.ofDays(3)));

            assertThat(resolver.effectivePlan(account, NOW)).isEqualTo(PlanTier.GO_PRO);
        }

        @Test
        @DisplayName("paid plan past expiry is free")
        void paidLapsed() {
            Account account = account(PlanTier.FAMILY_PRO, NOW.minusSeconds(1));

            assertThat(resolver.effectivePlan(account, NOW)).isEqualTo(PlanTier.GO_FREE);
        }

        @Test
        @DisplayName("expiry equal to now is still paid")
        void boundary() {
            assertThat(resolver.effectivePlan(account(PlanTier.GO_PRO, NOW), NOW)).isEqualTo(PlanTier.GO_PRO);
        }

        @Test
        @DisplayName("paid plan without expiry is kept")
        void paidWithoutExpiry() {
            assertThat(resolver.effectivePlan(account(PlanTier.GO_ULTRA, null), NOW)).isEqualTo(PlanTier.GO_ULTRA);
        }

        @Test
        @DisplayName("single-argument form reads the clock")
        void usesClock() {
            Account account = account(PlanTier.GO_PRO, NOW.plus(Duration.ofHours(1)));
            assertThat(resolver.effectivePlan(account)).isEqualTo(PlanTier.GO_PRO);

            clock.advance(Duration.ofHours(2));

            assertThat(resolver.effectivePlan(account)).isEqualTo(PlanTier.GO_FREE);
        }
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        @DisplayName("account that has not lapsed is returned untouched")
        void nothingToDo() {
            Account account = account(PlanTier.GO_PRO, NOW.plus(Duration.ofDays(1)));

            assertThat(resolver.refresh(account)).isSameAs(account);
            verifyNoInteractions(accountRepository, auditLogService, metricsService);
        }

        @Test
        @DisplayName("lapsed plan is downgraded, audited and counted")
        void downgrades() {
            Instant expiredAt = NOW.minus(Duration.ofDays(1));
            Account account = account(PlanTier.GO_PRO, expiredAt);
            when(accountRepository.downgradeIfExpired(account.getId(), PlanTier.GO_FREE, SubscriptionStatus.EXPIRED, NOW))
                    .thenReturn(1);

            Account refreshed = resolver.refresh(account);

            assertThat(refreshed.getPlan()).isEqualTo(PlanTier.GO_FREE);
            assertThat(refreshed.getSubscriptionStatus()).isEqualTo(SubscriptionStatus.EXPIRED);
            verify(auditLogService).record(eq(account.getId()), eq(AuditEventType.SUBSCRIPTION_AUTO_DOWNGRADE),
                    argThat((Map<String, ?> metadata) -> "GO_PRO".equals(metadata.get("old_plan"))
                            && "GO_FREE".equals(metadata.get("new_plan"))
                            && expiredAt.toString().equals(metadata.get("expired_at"))));
            verify(metricsService).incrementAutoDowngrade("GO_PRO");
        }

        @Test
        @DisplayName("lost conditional update returns the stored account without auditing")
        void renewedConcurrently() {
            Account stale = account(PlanTier.GO_PRO, NOW.minus(Duration.ofDays(1)));
            Account renewed = account(PlanTier.GO_PRO, NOW.plus(Duration.ofDays(30)));
            renewed.setId(stale.getId());
            when(accountRepository.downgradeIfExpired(any(), any(), any(), any())).thenReturn(0);
            when(accountRepository.findById(stale.getId())).thenReturn(Optional.of(renewed));

            Account result = resolver.refresh(stale);

            assertThat(result).isSameAs(renewed);
            verify(auditLogService, never()).record(any(), any(), anyMap());
            verify(metricsService, never()).incrementAutoDowngrade(any());
        }
    }
}
