package uk.gegc.gosuraksha.features.subscription.infra.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RevenueCat callbacks. Authenticated either by the shared secret as a bearer token or by an
 * HMAC-SHA256 hex digest of the raw body in {@code X-RevenueCat-Signature} / {@code X-Signature}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevenueCatProviderAdapter implements BillingProviderAdapter {

    public static final String PROVIDER = "revenuecat";

    private static final Set<String> CANCELED_TYPES =
            Set.of("CANCELLATION", "SUBSCRIPTION_CANCELED", "REFUND", "UNCANCELLATION_REVERSED");
    private static final Set<String> GRACE_TYPES =
            Set.of("BILLING_ISSUE", "SUBSCRIPTION_EXTENDED", "TEMPORARY_ENTITLEMENT_GRANT");

    private final WebhookProperties webhookProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public void verify(String payload, HttpHeaders headers) {
        String secret = webhookProperties.getRevenuecat().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new WebhookAuthenticationException("RevenueCat webhook secret not configured");
        }

        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.toLowerCase(Locale.ROOT).startsWith("bearer ")) {
            String supplied = authorization.substring(7).trim();
            if (constantTimeEquals(supplied, secret)) {
                return;
            }
        }

        String signature = headers.getFirst("X-RevenueCat-Signature");
        if (signature == null) {
            signature = headers.getFirst("X-Signature");
        }
        if (signature != null && payload != null
                && constantTimeEquals(signature.trim().toLowerCase(Locale.ROOT), hmacSha256Hex(payload, secret))) {
            return;
        }

        log.warn("RevenueCat webhook authentication failed");
        throw new WebhookAuthenticationException("Invalid webhook signature");
    }

    @Override
    public Optional<CanonicalSubscriptionEvent> parse(String payload, Instant receivedAt) {
        JsonNode root = readTree(payload);
        JsonNode event = root.hasNonNull("event") ? root.get("event") : root;
        if (!event.isObject()) {
            throw new MalformedSubscriptionEventException("event object is required");
        }

        String eventType = Optional.ofNullable(ProviderPayloads.text(event, "type"))
                .map(type -> type.toUpperCase(Locale.ROOT))
                .orElse("UNKNOWN");
        String eventId = ProviderPayloads.text(event, "id", "event_id");
        String accountRef = ProviderPayloads.text(event, "app_user_id", "original_app_user_id", "user_id");

        StringBuilder candidate = new StringBuilder();
        candidate.append(Objects.toString(ProviderPayloads.text(event, "product_id"), "")).append(' ')
                .append(Objects.toString(ProviderPayloads.text(event, "store_product_id"), ""));
        JsonNode entitlements = event.get("entitlement_ids");
        if (entitlements != null && entitlements.isArray()) {
            entitlements.forEach(entitlement -> candidate.append(' ').append(entitlement.asText()));
        }
        PlanTier plan = ProviderPayloads.planFromProductTokens(candidate.toString());

        Instant expiresAt = ProviderPayloads.timestamp(event,
                "expiration_at_ms", "expires_date_ms", "expiration_at", "expires_date");
        Instant eventAt = ProviderPayloads.timestamp(event,
                "event_timestamp_ms", "event_timestamp", "purchased_at_ms", "purchased_at",
                "event_created_at_ms", "event_created_at");
        if (eventAt == null) {
            eventAt = receivedAt;
        }

        return Optional.of(new CanonicalSubscriptionEvent(
                PROVIDER,
                eventId,
                eventType,
                accountRef,
                plan,
                statusFor(eventType, expiresAt, receivedAt),
                expiresAt,
                eventAt,
                payload
        ));
    }

    private static SubscriptionStatus statusFor(String eventType, Instant expiresAt, Instant now) {
        if (CANCELED_TYPES.contains(eventType)) {
            return SubscriptionStatus.CANCELED;
        }
        if (GRACE_TYPES.contains(eventType)) {
            return SubscriptionStatus.GRACE;
        }
        if (expiresAt != null && expiresAt.isBefore(now)) {
            return SubscriptionStatus.EXPIRED;
        }
        return SubscriptionStatus.ACTIVE;
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

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    static String hmacSha256Hex(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC calculation failed", e);
        }
    }
}
