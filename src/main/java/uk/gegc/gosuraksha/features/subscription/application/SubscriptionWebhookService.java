package uk.gegc.gosuraksha.features.subscription.application;

import org.springframework.http.HttpHeaders;

public interface SubscriptionWebhookService {

    enum Result { APPLIED, IGNORED_OUT_OF_ORDER, DUPLICATE, UNHANDLED }

    /**
     * Verifies, canonicalises and applies one provider callback.
     *
     * @param provider path segment naming the billing provider
     */
    WebhookOutcome process(String provider, String payload, HttpHeaders headers);
}
