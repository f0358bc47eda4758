package uk.gegc.gosuraksha.features.subscription.infra.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import uk.gegc.gosuraksha.features.account.domain.model.PlanTier;
import uk.gegc.gosuraksha.features.account.domain.model.SubscriptionStatus;
import uk.gegc.gosuraksha.features.subscription.application.BillingProviderAdapter;
import uk.gegc.gosuraksha.features.subscription.application.WebhookProperties;
import uk.gegc.gosuraksha.features.subscription.domain.exception.MalformedSubscriptionEventException;
import uk.gegc.gosuraksha.features.subscription.domain.exception.WebhookAuthenticationException;
import uk.gegc.gosuraksha.features.subscription.domain.model.CanonicalSubscriptionEvent;

import java.time.Instant;
import java.util.Optional;

/**
 * Stripe subscription callbacks. The account and plan are carried in subscription metadata
 * ({@code account_id}, {@code plan}) set at checkout; the price lookup key is the plan fallback.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeProviderAdapter implements BillingProviderAdapter {

    public static final String PROVIDER = "stripe";
    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final WebhookProperties webhookProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public void verify(String payload, HttpHeaders headers) {
        WebhookProperties.Stripe stripe = webhookProperties.getStripe();
        if (stripe.getSecret() == null || stripe.getSecret().isBlank()) {
            log.error("Stripe webhook secret not configured, rejecting callback");
            throw new WebhookAuthenticationException("Stripe webhook secret not configured");
        }
        String signatureHeader = headers.getFirst(SIGNATURE_HEADER);
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookAuthenticationException("Missing Stripe-Signature header");
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, stripe.getSecret(), stripe.getToleranceSeconds());
        } catch (SignatureVerificationException e) {
            log.warn("Invalid Stripe webhook signature: {}", e.getMessage());
            throw new WebhookAuthenticationException("Invalid webhook signature");
        }
    }

    @Override
    public Optional<CanonicalSubscriptionEvent> parse(String payload, Instant receivedAt) {
        JsonNode root = readTree(payload);
        String eventType = ProviderPayloads.text(root, "type");
        if (eventType == null) {
            throw new MalformedSubscriptionEventException("type is required");
        }
        JsonNode object = root.path("data").path("object");
        if (!object.isObject()) {
            throw new MalformedSubscriptionEventException("data.object is required", eventType);
        }

        Instant eventAt = Optional.ofNullable(ProviderPayloads.timestamp(root, "created")).orElse(receivedAt);
        String eventId = ProviderPayloads.text(root, "id");

        return switch (eventType) {
            case "customer.subscription.created", "customer.subscription.updated", "customer.subscription.deleted" -> {
                JsonNode metadata = object.path("metadata");
                SubscriptionStatus status = "customer.subscription.deleted".equals(eventType)
                        ? SubscriptionStatus.CANCELED
                        : statusFor(ProviderPayloads.text(object, "status"));
                yield Optional.of(new CanonicalSubscriptionEvent(
                        PROVIDER,
                        eventId,
                        eventType,
                        ProviderPayloads.text(metadata, "account_id"),
                        planFor(metadata, object),
                        status,
                        ProviderPayloads.timestamp(object, "current_period_end"),
                        eventAt,
                        payload
                ));
            }
            case "invoice.payment_failed" -> {
                JsonNode metadata = object.path("subscription_details").path("metadata");
                if (!metadata.isObject() || metadata.isEmpty()) {
                    metadata = object.path("metadata");
                }
                String planValue = ProviderPayloads.text(metadata, "plan");
                yield Optional.of(new CanonicalSubscriptionEvent(
                        PROVIDER,
                        eventId,
                        eventType,
                        ProviderPayloads.text(metadata, "account_id"),
                        planValue == null ? null : PlanTier.normalize(planValue),
                        SubscriptionStatus.GRACE,
                        planValue == null ? null : ProviderPayloads.timestamp(object, "period_end"),
                        eventAt,
                        payload
                ));
            }
            default -> {
                log.debug("Ignoring Stripe event type {}", eventType);
                yield Optional.empty();
            }
        };
    }

    private static PlanTier planFor(JsonNode metadata, JsonNode subscription) {
        String planValue = ProviderPayloads.text(metadata, "plan");
        if (planValue != null) {
            return PlanTier.normalize(planValue);
        }
        JsonNode items = subscription.path("items").path("data");
        if (items.isArray() && !items.isEmpty()) {
            String lookupKey = ProviderPayloads.text(items.get(0).path("price"), "lookup_key");
            return ProviderPayloads.planFromProductTokens(lookupKey);
        }
        return PlanTier.GO_FREE;
    }

    private static SubscriptionStatus statusFor(String stripeStatus) {
        if (stripeStatus == null) {
            return SubscriptionStatus.ACTIVE;
        }
        return switch (stripeStatus) {
            case "past_due", "unpaid", "incomplete" -> SubscriptionStatus.GRACE;
            case "canceled", "incomplete_expired" -> SubscriptionStatus.CANCELED;
            default -> SubscriptionStatus.ACTIVE;
        };
    }

    private JsonNode readTree(String payload) {
        try {
            JsonNode root = payload == null ? null : objectMapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new MalformedSubscriptionEventException("Invalid JSON payload");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedSubscriptionEventException("Invalid JSON payload");
        }
    }
}
