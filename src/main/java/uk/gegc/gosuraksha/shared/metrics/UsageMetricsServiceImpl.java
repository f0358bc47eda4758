package uk.gegc.gosuraksha.shared.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer counters for quota decisions and subscription webhooks. Tags are kept to bounded
 * sets (limit type, plan, provider, result); account ids never become tags.
 */
@Slf4j
@Service
public class UsageMetricsServiceImpl implements UsageMetricsService {

    private final MeterRegistry meterRegistry;

    public UsageMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void incrementQuotaAllowed(String limitType) {
        counter("quota.requests.allowed", "Quota checks that admitted the request", "limitType", limitType).increment();
    }

    @Override
    public void incrementQuotaDenied(String limitType, String plan) {
        log.debug("Metric: quota denied limitType={}, plan={}", limitType, plan);
        Counter.builder("quota.requests.denied")
                .description("Quota checks that rejected the request")
                .tag("limitType", limitType)
                .tag("plan", plan)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementCooldownShortCircuit(String limitType) {
        counter("quota.cooldown.short_circuit", "Rejections served from an active cooldown", "limitType", limitType).increment();
    }

    @Override
    public void incrementCounterStoreUnavailable(String operation) {
        log.debug("Metric: counter store unavailable during {}", operation);
        counter("quota.counter_store.unavailable", "Counter store failures that failed a request closed", "operation", operation).increment();
    }

    @Override
    public void incrementAbuseGuardDenied(String guard) {
        counter("quota.abuse_guard.denied", "Requests rejected by abuse throttles", "guard", guard).increment();
    }

    @Override
    public void incrementWebhookReceived(String provider, String eventType) {
        log.debug("Metric: webhook received provider={}, type={}", provider, eventType);
        counter("subscription.webhooks.received", "Subscription webhooks received", "provider", provider).increment();
    }

    @Override
    public void incrementWebhookResult(String provider, String result) {
        Counter.builder("subscription.webhooks.processed")
                .description("Subscription webhooks by processing outcome")
                .tag("provider", provider)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordWebhookLatency(String provider, long latencyMs) {
        Timer.builder("subscription.webhooks.latency")
                .description("Subscription webhook processing latency")
                .tag("provider", provider)
                .register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void incrementAutoDowngrade(String fromPlan) {
        log.debug("Metric: auto downgrade from {}", fromPlan);
        counter("subscription.auto_downgrades", "Lapsed paid plans downgraded to free", "fromPlan", fromPlan).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue == null ? "unknown" : tagValue)
                .register(meterRegistry);
    }
}
