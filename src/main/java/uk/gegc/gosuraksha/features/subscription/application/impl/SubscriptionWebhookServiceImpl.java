package uk.gegc.gosuraksha.features.subscription.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.gosuraksha.features.account.domain.exception.AccountNotFoundException;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.subscription.application.BillingProviderAdapter;
import uk.gegc.gosuraksha.features.subscription.application.SubscriptionEventApplier;
import uk.gegc.gosuraksha.features.subscription.application.SubscriptionWebhookService;
import uk.gegc.gosuraksha.features.subscription.application.WebhookLoggingContext;
import uk.gegc.gosuraksha.features.subscription.application.WebhookOutcome;
import uk.gegc.gosuraksha.features.subscription.domain.exception.DuplicateSubscriptionEventException;
import uk.gegc.gosuraksha.features.subscription.domain.exception.MalformedSubscriptionEventException;
import uk.gegc.gosuraksha.features.subscription.domain.exception.UnsupportedBillingProviderException;
import uk.gegc.gosuraksha.features.subscription.domain.model.CanonicalSubscriptionEvent;
import uk.gegc.gosuraksha.features.subscription.domain.repository.SubscriptionEventRepository;
import uk.gegc.gosuraksha.shared.audit.AuditEventType;
import uk.gegc.gosuraksha.shared.audit.AuditLogService;
import uk.gegc.gosuraksha.shared.metrics.UsageMetricsService;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class SubscriptionWebhookServiceImpl implements SubscriptionWebhookService {

    static final int AUDIT_PAYLOAD_LIMIT = 2000;
    static final int MAX_EVENT_TYPE_LENGTH = 64;

    private final Map<String, BillingProviderAdapter> adapters;
    private final SubscriptionEventApplier eventApplier;
    private final SubscriptionEventRepository subscriptionEventRepository;
    private final AuditLogService auditLogService;
    private final UsageMetricsService metricsService;
    private final Clock clock;

    public SubscriptionWebhookServiceImpl(List<BillingProviderAdapter> adapters,
                                          SubscriptionEventApplier eventApplier,
                                          SubscriptionEventRepository subscriptionEventRepository,
                                          AuditLogService auditLogService,
                                          UsageMetricsService metricsService,
                                          Clock clock) {
        this.adapters = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(BillingProviderAdapter::provider, Function.identity()));
        this.eventApplier = eventApplier;
        this.subscriptionEventRepository = subscriptionEventRepository;
        this.auditLogService = auditLogService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public WebhookOutcome process(String provider, String payload, HttpHeaders headers) {
        long startTime = System.currentTimeMillis();
        String providerKey = provider == null ? "" : provider.toLowerCase(Locale.ROOT);
        BillingProviderAdapter adapter = adapters.get(providerKey);
        if (adapter == null) {
            throw new UnsupportedBillingProviderException(provider);
        }

        // No ledger row and no audit entry for callbacks that fail authentication
        adapter.verify(payload, headers);

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .provider(providerKey)
                .build();

        try {
            Optional<CanonicalSubscriptionEvent> parsed;
            try {
                parsed = adapter.parse(payload, clock.instant());
                parsed.ifPresent(this::validate);
            } catch (MalformedSubscriptionEventException e) {
                String type = e.getEventType() != null ? e.getEventType() : "UNKNOWN_PARSE_ERROR";
                recordWebhookAudit(null, type, payload);
                metricsService.incrementWebhookResult(providerKey, "malformed");
                loggingContext.logWarn(log, "Rejected malformed {} webhook: {}", providerKey, e.getMessage());
                throw e;
            }

            if (parsed.isEmpty()) {
                metricsService.incrementWebhookResult(providerKey, "unhandled");
                loggingContext.logInfo(log, "Ignoring {} webhook with untracked event type", providerKey);
                return WebhookOutcome.unhandled(null, null);
            }

            CanonicalSubscriptionEvent event = parsed.get();
            loggingContext.setEventId(event.eventId());
            loggingContext.setEventType(event.eventType());
            loggingContext.setAccountRef(event.accountRef());
            metricsService.incrementWebhookReceived(providerKey, event.eventType());
            loggingContext.logInfo(log, "Processing subscription webhook: id={} type={}", event.eventId(), event.eventType());

            if (subscriptionEventRepository.existsByEventId(event.eventId())) {
                recordWebhookAudit(null, event.eventType() + "_DUPLICATE", payload);
                metricsService.incrementWebhookResult(providerKey, "duplicate");
                loggingContext.logInfo(log, "Duplicate subscription webhook id={}", event.eventId());
                return WebhookOutcome.duplicate(event.eventId(), event.eventType());
            }

            WebhookOutcome outcome;
            try {
                outcome = eventApplier.apply(event);
            } catch (DataIntegrityViolationException e) {
                if (!subscriptionEventRepository.existsByEventId(event.eventId())) {
                    // Not an event id collision; fail so the provider redelivers
                    metricsService.incrementWebhookResult(providerKey, "store_error");
                    loggingContext.logError(log, "Ledger insert for subscription webhook id={} failed", event.eventId(), e);
                    throw e;
                }
                // Lost the ledger insert race to a concurrent delivery of the same event
                recordWebhookAudit(null, event.eventType() + "_DUPLICATE", payload);
                metricsService.incrementWebhookResult(providerKey, "duplicate_race");
                loggingContext.logWarn(log, "Duplicate subscription webhook id={} detected at insert", event.eventId());
                throw new DuplicateSubscriptionEventException(event.eventId(), e);
            } catch (AccountNotFoundException e) {
                recordWebhookAudit(null, event.eventType(), payload);
                metricsService.incrementWebhookResult(providerKey, "unknown_account");
                loggingContext.logWarn(log, "Subscription webhook id={} references unknown account", event.eventId());
                throw e;
            }

            recordOutcome(outcome, event, payload);
            metricsService.incrementWebhookResult(providerKey, outcome.result().name().toLowerCase(Locale.ROOT));
            return outcome;
        } finally {
            metricsService.recordWebhookLatency(providerKey, System.currentTimeMillis() - startTime);
            WebhookLoggingContext.clearMDC();
        }
    }

    private void validate(CanonicalSubscriptionEvent event) {
        if (!StringUtils.hasText(event.eventId())) {
            throw new MalformedSubscriptionEventException("event_id is required", event.eventType());
        }
        if (event.eventId().length() > 128) {
            throw new MalformedSubscriptionEventException("event_id exceeds 128 characters", event.eventType());
        }
        if (!StringUtils.hasText(event.eventType())) {
            throw new MalformedSubscriptionEventException("event type is required", null);
        }
        if (event.eventType().length() > MAX_EVENT_TYPE_LENGTH) {
            throw new MalformedSubscriptionEventException(
                    "event type exceeds " + MAX_EVENT_TYPE_LENGTH + " characters", null);
        }
        if (!StringUtils.hasText(event.accountRef())) {
            throw new MalformedSubscriptionEventException("app_user_id is required", event.eventType());
        }
        if (event.status() == null) {
            throw new MalformedSubscriptionEventException("subscription status could not be derived", event.eventType());
        }
        if (!event.keepsCurrentPlan() && event.status() == SubscriptionStatus.ACTIVE
                && event.plan().isPaid() && event.expiresAt() == null) {
            throw new MalformedSubscriptionEventException(
                    "ACTIVE subscriptions require expiration timestamp", event.eventType());
        }
    }

    private void recordOutcome(WebhookOutcome outcome, CanonicalSubscriptionEvent event, String payload) {
        recordWebhookAudit(outcome.accountId(), event.eventType(), payload);
        if (outcome.result() != Result.APPLIED) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", event.eventType());
        metadata.put("plan", outcome.previousPlan() + "->" + outcome.plan());
        metadata.put("status", outcome.previousStatus() + "->" + outcome.status());
        metadata.put("expires", outcome.previousExpiresAt() + "->" + outcome.expiresAt());
        metadata.put("event_at", String.valueOf(event.eventAt()));
        auditLogService.record(outcome.accountId(), AuditEventType.SUBSCRIPTION_UPDATED, metadata);
    }

    private void recordWebhookAudit(UUID accountId, String eventType, String payload) {
        String compact = payload == null ? "" : payload.substring(0, Math.min(payload.length(), AUDIT_PAYLOAD_LIMIT));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", eventType);
        metadata.put("payload", compact);
        auditLogService.record(accountId, AuditEventType.SUBSCRIPTION_WEBHOOK_EVENT, metadata);
    }
}
