package uk.gegc.gosuraksha.shared.metrics;

public interface UsageMetricsService {

    void incrementQuotaAllowed(String limitType);

    void incrementQuotaDenied(String limitType, String plan);

    void incrementCooldownShortCircuit(String limitType);

    void incrementCounterStoreUnavailable(String operation);

    void incrementAbuseGuardDenied(String guard);

    void incrementWebhookReceived(String provider, String eventType);

    void incrementWebhookResult(String provider, String result);

    void recordWebhookLatency(String provider, long latencyMs);

    void incrementAutoDowngrade(String fromPlan);
}
