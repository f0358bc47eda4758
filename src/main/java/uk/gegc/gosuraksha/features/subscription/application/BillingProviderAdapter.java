package uk.gegc.gosuraksha.features.subscription.application;

import org.springframework.http.HttpHeaders;
import uk.gegc.gosuraksha.features.subscription.domain.model.CanonicalSubscriptionEvent;

import java.time.Instant;
import java.util.Optional;

/**
 * Translates one billing provider's callbacks into canonical subscription events.
 */
public interface BillingProviderAdapter {

    /** Path segment under {@code /webhooks/}. */
    String provider();

    /**
     * @throws uk.gegc.gosuraksha.features.subscription.domain.exception.WebhookAuthenticationException
     *         when the callback cannot be authenticated
     */
    void verify(String payload, HttpHeaders headers);

    /**
     * @return the canonical event, or empty for event types this provider adapter does not track
     * @throws uk.gegc.gosuraksha.features.subscription.domain.exception.MalformedSubscriptionEventException
     *         when required fields cannot be derived
     */
    Optional<CanonicalSubscriptionEvent> parse(String payload, Instant receivedAt);
}
